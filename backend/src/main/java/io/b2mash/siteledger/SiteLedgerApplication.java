package io.b2mash.siteledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.retry.annotation.EnableRetry;

@SpringBootApplication
@EnableRetry
@ConfigurationPropertiesScan
public class SiteLedgerApplication {

  public static void main(String[] args) {
    SpringApplication.run(SiteLedgerApplication.class, args);
  }
}
