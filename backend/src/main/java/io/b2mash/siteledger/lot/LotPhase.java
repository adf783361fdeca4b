package io.b2mash.siteledger.lot;

/** Pre-sale lots belong to a quote, post-sale lots to a site budget. */
public enum LotPhase {
  QUOTE,
  SITE
}
