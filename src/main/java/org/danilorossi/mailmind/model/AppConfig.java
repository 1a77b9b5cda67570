package org.danilorossi.mailmind.model;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.val;
import org.danilorossi.mailmind.helpers.LangUtils;

/** Radice di mailmind.json. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AppConfig {

  @Builder.Default private List<Account> accounts = new ArrayList<>();

  @Builder.Default private ProcessingOptions options = ProcessingOptions.builder().build();

  @Builder.Default private ClassifierConfig classifier = ClassifierConfig.builder().build();

  /** Controlli globali; i singoli account vengono validati dal rispettivo worker. */
  public void validate() throws IllegalArgumentException {
    if (accounts == null || accounts.isEmpty())
      throw new IllegalArgumentException("No email accounts configured");
    if (options == null) options = ProcessingOptions.builder().build();
    if (classifier == null) classifier = ClassifierConfig.builder().build();
    options.validate();

    val names = new HashSet<String>();
    for (val a : accounts) {
      if (a == null) throw new IllegalArgumentException("Null account entry");
      if (!LangUtils.empty(a.getName()) && !names.add(a.getName().trim().toLowerCase()))
        throw new IllegalArgumentException(
            LangUtils.s("Duplicate account name '{}'", a.getName()));
    }
  }
}
