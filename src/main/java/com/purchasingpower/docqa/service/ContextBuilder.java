package com.purchasingpower.docqa.service;

import com.purchasingpower.docqa.configuration.AppProperties;
import com.purchasingpower.docqa.knowledge.ScoredChunk;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Assembles retrieved passages into the context block of a prompt.
 *
 * Passages arrive best first. Each is prefixed with its source; when the
 * character budget runs out the remaining (lower scoring) passages are left out.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ContextBuilder {

    private static final String SEPARATOR = "\n\n";

    private final AppProperties appProperties;

    public BuiltContext build(List<ScoredChunk> passages) {
        int maxChars = appProperties.getContext().getMaxChars();
        StringBuilder context = new StringBuilder();
        List<ScoredChunk> used = new ArrayList<>();

        for (ScoredChunk passage : passages) {
            String header = "[Source " + (used.size() + 1) + ": " + passage.getDocumentName()
                    + " (document " + passage.getDocumentId() + ")]\n";
            String separator = context.length() == 0 ? "" : SEPARATOR;
            int available = maxChars - context.length() - separator.length() - header.length();

            if (passage.getContent().length() <= available) {
                context.append(separator).append(header).append(passage.getContent());
                used.add(passage);
            } else if (used.isEmpty() && available > 0) {
                // the best passage alone is too long: keep its beginning
                context.append(header).append(passage.getContent(), 0, available);
                used.add(passage);
                break;
            } else {
                break;
            }
        }

        if (used.size() < passages.size()) {
            log.debug("📏 Context budget {} chars: kept {} of {} passages", maxChars, used.size(), passages.size());
        }

        Set<String> documentNames = new LinkedHashSet<>();
        used.forEach(p -> documentNames.add(p.getDocumentName()));
        return new BuiltContext(context.toString(), List.copyOf(used), List.copyOf(documentNames));
    }

    @Value
    public static class BuiltContext {
        String text;
        List<ScoredChunk> passages;
        List<String> documentNames;

        public int length() {
            return text.length();
        }
    }
}
