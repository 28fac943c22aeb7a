package io.pdslabel.parser.api.statements;

import io.pdslabel.parser.api.Identifier;
import io.pdslabel.parser.api.LabelValidationException;

final class BlockNames {
  private BlockNames() {}

  static void check(Identifier identifier, String what) {
    if (identifier == null) {
      throw new LabelValidationException(what + " identifier must not be null");
    }
    if (!identifier.isPlain()) {
      throw new LabelValidationException(
          what + " identifier must not have a namespace or pointer marker", identifier.text());
    }
  }
}
