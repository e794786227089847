/*
 * どこで: Lead Gateway CRM 下流 DTO
 * 何を: CRM の Leads モジュール 1 レコード分の項目を表現する
 * なぜ: 取得/検索/作成/更新で同じ項目名 (API 名) を使うため
 */
package com.opulenthorizons.leadgateway.crm.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.OffsetDateTime;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record LeadRecord(
    @JsonProperty("id") String id,
    @JsonProperty("First_Name") String firstName,
    @JsonProperty("Last_Name") String lastName,
    @JsonProperty("Email") String email,
    @JsonProperty("Phone") String phone,
    @JsonProperty("Lead_Source") String leadSource,
    @JsonProperty("External_Id") String externalId,
    @JsonProperty("Modified_Time") OffsetDateTime modifiedTime) {}
