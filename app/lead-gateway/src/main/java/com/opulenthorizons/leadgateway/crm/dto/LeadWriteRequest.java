package com.opulenthorizons.leadgateway.crm.dto;

import java.util.List;

public record LeadWriteRequest(List<LeadRecord> data) {

  public LeadWriteRequest {
    data = data == null ? List.of() : List.copyOf(data);
  }

  public static LeadWriteRequest of(LeadRecord record) {
    return new LeadWriteRequest(List.of(record));
  }
}
