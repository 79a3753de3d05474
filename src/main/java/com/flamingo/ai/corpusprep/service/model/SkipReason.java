package com.flamingo.ai.corpusprep.service.model;

/** Why a source, or one record of a source, contributed nothing to the corpus. */
public enum SkipReason {
  UNSUPPORTED_FORMAT,
  NOT_FOUND,
  UNREADABLE,
  FETCH_FAILED,
  EXTRACTION_FAILED,
  MISSING_TEXT_FIELD,
  EMPTY_CONTENT,
  UNEXPECTED_ERROR
}
