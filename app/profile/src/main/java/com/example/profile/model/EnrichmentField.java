package com.example.profile.model;

/** decorated view に付与される任意項目。 */
public enum EnrichmentField {
  ADDRESS_DETAIL("address_detail"),
  SCHEDULED_DELIVERY("scheduled_delivery"),
  TERMS_OF_SERVICE("terms_of_service"),
  BLOCKED_ITEM_TYPES("blocked_item_types");

  private final String metricName;

  EnrichmentField(String metricName) {
    this.metricName = metricName;
  }

  public String metricName() {
    return metricName;
  }
}
