package com.eainde.admission.rag;

import com.eainde.admission.config.AdmissionProperties;
import com.eainde.admission.exception.AdmissionException;
import com.eainde.admission.exception.ValidationException;
import lombok.extern.log4j.Log4j2;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Application-independent access to the admission rulebook.
 *
 * <p>Owns the lifecycle of the shared {@link RuleIndex}: on startup it restores the
 * persisted index when one exists, otherwise it reads the rulebook, rebuilds the index
 * and persists it. Rebuilds never interrupt running decisions because the index swaps
 * its snapshot atomically.</p>
 */
@Log4j2
public class RulebookService {

    static final String NO_RULES_FOUND = "No relevant rules found in the rulebook.";

    private final RuleIndex ruleIndex;
    private final RulebookLoader loader;
    private final RuleIndexFileStore fileStore;
    private final RulebookAssistant assistant;
    private final AdmissionProperties.Rules settings;

    public RulebookService(RuleIndex ruleIndex,
                           RulebookLoader loader,
                           RuleIndexFileStore fileStore,
                           RulebookAssistant assistant,
                           AdmissionProperties.Rules settings) {
        this.ruleIndex = ruleIndex;
        this.loader = loader;
        this.fileStore = fileStore;
        this.assistant = assistant;
        this.settings = settings;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void initializeOnStartup() {
        if (!settings.isInitializeOnStartup()) {
            log.info("Rule index initialization on startup is disabled");
            return;
        }
        try {
            RuleIndexStatus status = initialize(false);
            log.info("Rule index ready: {} chunks, build {}", status.chunkCount(), status.buildId());
        } catch (RuntimeException e) {
            log.error("Rule index initialization failed; rule queries stay unavailable until initialize() succeeds", e);
        }
    }

    /**
     * Loads the persisted index, or rebuilds it from the rulebook when no index was
     * persisted yet or {@code forceReload} is set.
     */
    public synchronized RuleIndexStatus initialize(boolean forceReload) {
        Path indexPath = Path.of(settings.getIndexPath());
        if (!forceReload && Files.exists(indexPath)) {
            RuleIndexFileStore.LoadedIndex loaded = fileStore.read(indexPath);
            if (loaded.dimension() == ruleIndex.dimension()) {
                log.info("Restoring persisted rule index {} from {}", loaded.buildId(), indexPath);
                return ruleIndex.restore(loaded.chunks(), loaded.buildId(), loaded.builtAt());
            }
            log.warn("Persisted rule index {} has {} dimensions but the embedding model produces {}; rebuilding",
                    loaded.buildId(), loaded.dimension(), ruleIndex.dimension());
        }

        Path rulebookPath = Path.of(settings.getRulebookPath());
        List<RulebookPage> pages;
        try {
            pages = loader.load(rulebookPath);
        } catch (IOException e) {
            throw new AdmissionException("Failed to read rulebook " + rulebookPath, e);
        }
        RuleIndexStatus status = ruleIndex.rebuild(pages);
        try {
            fileStore.write(ruleIndex.current(), indexPath);
        } catch (UncheckedIOException e) {
            log.warn("Rule index {} is active but could not be persisted", status.buildId(), e);
        }
        return status;
    }

    public RuleIndexStatus status() {
        return ruleIndex.status();
    }

    /**
     * Returns the rulebook passages most relevant to {@code question}, best first.
     */
    public List<RuleReference> queryRules(String question) {
        if (question == null || question.isBlank()) {
            throw new ValidationException("Question must not be blank");
        }
        return ruleIndex.query(question, settings.getQueryTopK()).stream()
                .map(hit -> new RuleReference(hit.chunk().text(), hit.chunk().citation(), hit.similarity()))
                .collect(Collectors.toList());
    }

    /**
     * Answers a free-text question from the retrieved passages, citing their pages.
     */
    public RuleAnswer ask(String question) {
        List<RuleReference> sources = queryRules(question);
        if (sources.isEmpty()) {
            return new RuleAnswer(question, NO_RULES_FOUND, List.of());
        }
        String context = sources.stream()
                .map(ref -> "[" + ref.citation().label() + "]\n" + ref.chunkText())
                .collect(Collectors.joining("\n\n"));
        String answer = assistant.answer(context, question);
        log.debug("Answered rulebook question from {} passages", sources.size());
        return new RuleAnswer(question, answer, sources);
    }
}
