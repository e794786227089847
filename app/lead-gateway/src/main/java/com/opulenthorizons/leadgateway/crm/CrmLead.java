/*
 * どこで: Lead Gateway CRM 連携
 * 何を: CRM 側のリードをドメイン側の連絡先項目に写像した値
 * なぜ: 氏名の分割/結合や空文字の扱いを API 境界に閉じ込めるため
 */
package com.opulenthorizons.leadgateway.crm;

import com.opulenthorizons.leadgateway.model.ContactField;
import java.time.Instant;

public record CrmLead(
    String id,
    String name,
    String email,
    String phone,
    String leadSource,
    String externalId,
    Instant modifiedAt) {

  public String valueOf(ContactField field) {
    return switch (field) {
      case NAME -> name;
      case EMAIL -> email;
      case PHONE -> phone;
    };
  }
}
