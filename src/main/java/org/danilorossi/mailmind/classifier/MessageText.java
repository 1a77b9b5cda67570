package org.danilorossi.mailmind.classifier;

import lombok.NonNull;
import lombok.Value;
import org.danilorossi.mailmind.model.MessageRef;

/** Email pronta per la classificazione: metadati più testo estratto. */
@Value
public class MessageText {
  @NonNull MessageRef ref;
  @NonNull String body;
}
