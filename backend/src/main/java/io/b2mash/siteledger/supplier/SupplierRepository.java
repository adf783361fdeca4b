package io.b2mash.siteledger.supplier;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface SupplierRepository extends JpaRepository<Supplier, UUID> {

  @Query("SELECT s FROM Supplier s WHERE s.id = :id AND s.deletedAt IS NULL")
  Optional<Supplier> findLiveById(@Param("id") UUID id);

  @Query("SELECT s FROM Supplier s WHERE s.taxId = :taxId AND s.deletedAt IS NULL")
  Optional<Supplier> findLiveByTaxId(@Param("taxId") String taxId);

  @Query(
      """
      SELECT s FROM Supplier s
      WHERE s.deletedAt IS NULL
        AND (:activeOnly = false OR s.active = true)
      ORDER BY s.name
      """)
  List<Supplier> findAllLive(@Param("activeOnly") boolean activeOnly);
}
