/*
 * どこで: Lead Gateway ツール API
 * 何を: get_crm_record の応答。見つからない場合は found=false とメッセージだけを返す
 * なぜ: 同期を走らせずに CRM 側の現在値を確認できるようにするため
 */
package com.opulenthorizons.leadgateway.tool.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.opulenthorizons.leadgateway.crm.CrmLead;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GetCrmRecordResponse(
    boolean found,
    String recordId,
    String name,
    String email,
    String phone,
    String leadSource,
    String externalId,
    Instant modifiedAt,
    String message) {

  public static GetCrmRecordResponse found(CrmLead lead) {
    return new GetCrmRecordResponse(
        true,
        lead.id(),
        lead.name(),
        lead.email(),
        lead.phone(),
        lead.leadSource(),
        lead.externalId(),
        lead.modifiedAt(),
        null);
  }

  public static GetCrmRecordResponse notFound(String recordId) {
    return new GetCrmRecordResponse(
        false, recordId, null, null, null, null, null, null, "No CRM record " + recordId);
  }
}
