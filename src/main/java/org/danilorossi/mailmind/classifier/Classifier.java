package org.danilorossi.mailmind.classifier;

import java.util.List;
import org.danilorossi.mailmind.model.Category;

/**
 * Servizio esterno di classificazione. Riceve un gruppo di email e restituisce un risultato per
 * ciascuna, nello stesso ordine. Il nome di categoria restituito non è garantito valido.
 */
@FunctionalInterface
public interface Classifier {

  List<ClassificationResult> classify(List<Category> categories, List<MessageText> batch)
      throws ClassificationException;
}
