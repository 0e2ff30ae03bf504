package fr.lapetina.gateway.provider.domain.matching;

import fr.lapetina.gateway.provider.domain.model.ConfigurationSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Scores every source by the number of request keys whose value equals the
 * source's declared value for that key, and picks the strictly highest score.
 *
 * <p>Equal scores keep the earlier source in declaration order. A score of
 * zero never matches: the default source is only reachable through the
 * resolver's fallback.
 */
public final class ScoreBasedSourceMatcher implements SourceMatcher {

    private static final Logger log = LoggerFactory.getLogger(ScoreBasedSourceMatcher.class);

    @Override
    public String getName() {
        return "score-based";
    }

    @Override
    public Optional<ConfigurationSource> match(List<ConfigurationSource> sources, Map<String, String> requestMetadata) {
        if (sources == null || sources.isEmpty() || requestMetadata == null || requestMetadata.isEmpty()) {
            return Optional.empty();
        }

        ConfigurationSource best = null;
        int bestScore = 0;

        for (ConfigurationSource source : sources) {
            int score = score(source, requestMetadata);
            if (score > bestScore) {
                bestScore = score;
                best = source;
            }
        }

        if (best != null) {
            log.debug("Matched config {} with score {}", best.getId(), bestScore);
        }
        return Optional.ofNullable(best);
    }

    /**
     * Number of request keys the source declares with exactly the same value.
     */
    public int score(ConfigurationSource source, Map<String, String> requestMetadata) {
        Map<String, String> declared = source.getDeclaredMetadata();
        int score = 0;
        for (Map.Entry<String, String> entry : requestMetadata.entrySet()) {
            String value = declared.get(entry.getKey());
            if (value != null && value.equals(entry.getValue())) {
                score++;
            }
        }
        return score;
    }
}
