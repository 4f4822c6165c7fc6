package com.finalsentence.application;

import com.finalsentence.application.port.PersistenceGateway;
import com.finalsentence.domain.Phrase;
import jakarta.annotation.PostConstruct;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Candidate phrases for rounds.
 *
 * <p>Loaded once: stored phrases first, then the built-in list, skipping any text already seen
 * (compared after trimming). The built-in list guarantees the pool is never empty, even when the
 * store is unreachable.
 */
@Component
public class PhrasePool {
  private static final Logger log = LoggerFactory.getLogger(PhrasePool.class);

  static final List<String> BUILT_IN =
      List.of(
          "La sombra avanzaba silenciosa por el pasillo.",
          "El espejo reflejó una habitación que no era la mía.",
          "Cada vez que parpadeaba, alguien estaba más cerca.",
          "Las luces titilaron y la figura estaba ya detrás de mí.",
          "Encontré una nota que decía: vuelve a dormir.",
          "El susurro decía mi nombre detrás de la puerta.",
          "Al abrir la puerta, nadie respondió al llamado.");

  private final PersistenceGateway store;
  private final int loadLimit;
  private final Random rnd;

  private volatile List<Phrase> phrases = List.of();

  @Autowired
  public PhrasePool(
      PersistenceGateway store, @Value("${finalsentence.phrase-load-limit:100}") int loadLimit) {
    this(store, loadLimit, new SecureRandom());
  }

  PhrasePool(PersistenceGateway store, int loadLimit, Random rnd) {
    this.store = store;
    this.loadLimit = loadLimit;
    this.rnd = rnd;
  }

  @PostConstruct
  public void load() {
    List<Phrase> merged = new ArrayList<>();
    Set<String> seen = new HashSet<>();

    List<Phrase> stored;
    try {
      stored = store.getPhrases(loadLimit);
    } catch (RuntimeException e) {
      log.warn("Could not load phrases from store, using built-in list only: {}", e.getMessage());
      stored = List.of();
    }
    for (Phrase p : stored) {
      String t = p.text() == null ? "" : p.text().trim();
      if (!t.isEmpty() && seen.add(t)) {
        merged.add(new Phrase(p.id(), t, p.difficulty(), p.category()));
      }
    }
    int fromStore = merged.size();

    for (int i = 0; i < BUILT_IN.size(); i++) {
      String t = BUILT_IN.get(i).trim();
      if (seen.add(t)) {
        merged.add(new Phrase("local_" + i, t, "media", "terror"));
      }
    }

    phrases = List.copyOf(merged);
    log.info("Phrase pool ready: {} phrases ({} from store)", phrases.size(), fromStore);
  }

  /** Uniform random pick. */
  public Phrase draw() {
    List<Phrase> all = phrases;
    if (all.isEmpty()) {
      throw new IllegalStateException("Phrase pool not loaded");
    }
    return all.get(rnd.nextInt(all.size()));
  }

  public List<Phrase> all() {
    return phrases;
  }
}
