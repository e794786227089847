package com.opulenthorizons.leadgateway.service;

import com.opulenthorizons.leadgateway.model.WorkflowEventRecord;

/** コミット済みのワークフローイベントを後続システムへ通知する。失敗しても例外は投げない。 */
public interface WorkflowEventPublisher {

  void publish(WorkflowEventRecord event);
}
