package com.opulenthorizons.leadgateway.crm.dto;

import java.util.List;

public record LeadListResponse(List<LeadRecord> data) {

  public LeadListResponse {
    data = data == null ? List.of() : List.copyOf(data);
  }
}
