package com.triagesentinel.analyzer.signature;

import com.triagesentinel.analyzer.config.PipelineConfig;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Evaluates the compiled signature rules against file contents.
 *
 * <p>
 * Rules are loaded once at startup from every {@code *.yar} / {@code *.yara}
 * file below {@code sentinel.pipeline.rules-dir}. A file that fails to
 * compile is skipped with a warning and the remaining files still load. An
 * absent rules directory leaves the engine empty, so every scan returns no
 * matches.
 * </p>
 *
 * @author Naveed Gung
 */
@Component
public class SignatureEngine {

    private static final Logger log = LoggerFactory.getLogger(SignatureEngine.class);

    private final Path rulesDir;
    private volatile List<SignatureRuleSet> ruleSets;

    @Autowired
    public SignatureEngine(PipelineConfig pipelineConfig) {
        this.rulesDir = pipelineConfig.rulesPath();
        this.ruleSets = List.of();
    }

    public SignatureEngine(List<SignatureRuleSet> ruleSets) {
        this.rulesDir = null;
        this.ruleSets = List.copyOf(ruleSets);
    }

    @PostConstruct
    public void init() {
        if (rulesDir != null) {
            ruleSets = load(rulesDir);
        }
    }

    /**
     * Compile every rule file below a directory.
     */
    public static List<SignatureRuleSet> load(Path dir) {
        if (!Files.isDirectory(dir)) {
            log.warn("Rules directory {} does not exist; signature matching disabled", dir);
            return List.of();
        }
        List<Path> files;
        try (Stream<Path> walk = Files.walk(dir)) {
            files = walk.filter(Files::isRegularFile)
                    .filter(SignatureEngine::isRuleFile)
                    .sorted()
                    .toList();
        } catch (IOException e) {
            log.error("Cannot list rules directory {}: {}", dir, e.getMessage());
            return List.of();
        }

        List<SignatureRuleSet> sets = new ArrayList<>();
        int ruleCount = 0;
        for (Path file : files) {
            String origin = dir.relativize(file).toString();
            try {
                String text = Files.readString(file, StandardCharsets.UTF_8);
                List<SignatureRule> rules = RuleParser.parse(text, origin);
                sets.add(new SignatureRuleSet(origin, rules));
                ruleCount += rules.size();
            } catch (RuleSyntaxException e) {
                log.warn("Skipping rule file with syntax error: {}", e.getMessage());
            } catch (IOException e) {
                log.warn("Skipping unreadable rule file {}: {}", file, e.getMessage());
            }
        }
        log.info("Loaded {} signature rules from {} files in {}", ruleCount, sets.size(), dir);
        return List.copyOf(sets);
    }

    private static boolean isRuleFile(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".yar") || name.endsWith(".yara");
    }

    /**
     * Evaluate all rules against the first {@code length} bytes of
     * {@code data}.
     *
     * @return matches in rule-file then declaration order
     */
    public List<SignatureMatch> scan(byte[] data, int length) {
        List<SignatureMatch> matches = new ArrayList<>();
        for (SignatureRuleSet set : ruleSets) {
            for (SignatureRule rule : set.rules()) {
                List<String> hit = rule.evaluate(data, length);
                if (!hit.isEmpty()) {
                    matches.add(SignatureMatch.of(rule, set.source(), hit));
                }
            }
        }
        return matches;
    }

    public int ruleCount() {
        return ruleSets.stream().mapToInt(s -> s.rules().size()).sum();
    }

    public boolean hasRules() {
        return ruleCount() > 0;
    }
}
