package com.ethicalai.scoring.exception;

import java.util.List;

/** Raised when questionnaire answers do not cover every configured question. */
public class IncompleteAssessmentException extends RuntimeException {

  private final List<String> missingQuestionIds;

  public IncompleteAssessmentException(List<String> missingQuestionIds) {
    super("Assessment is incomplete; unanswered questions: " + missingQuestionIds);
    this.missingQuestionIds = List.copyOf(missingQuestionIds);
  }

  public List<String> getMissingQuestionIds() {
    return missingQuestionIds;
  }
}
