package io.intellixity.semgate.governance.catalog;

import io.intellixity.semgate.governance.GovernanceDocument;

import java.util.Objects;

/** Supplies the governance document a catalog index resolves members against. */
@FunctionalInterface
public interface GovernanceDocumentSource {
  GovernanceDocument load();

  static GovernanceDocumentSource fixed(GovernanceDocument document) {
    Objects.requireNonNull(document, "document");
    return () -> document;
  }
}
