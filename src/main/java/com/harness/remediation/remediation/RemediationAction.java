package com.harness.remediation.remediation;

import com.harness.remediation.enums.RemediationDirective;

public interface RemediationAction {

  RemediationDirective directive();

  /**
   * Brings the resource with the given durable identifier into compliance.
   *
   * @throws RemediationException when the resource cannot be found or the
   *     action is missing its desired value
   */
  void remediate(String resourceId);
}
