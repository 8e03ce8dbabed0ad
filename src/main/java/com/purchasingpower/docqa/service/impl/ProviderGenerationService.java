package com.purchasingpower.docqa.service.impl;

import com.purchasingpower.docqa.client.LLMProvider;
import com.purchasingpower.docqa.client.LLMProviderFactory;
import com.purchasingpower.docqa.exception.GenerationException;
import com.purchasingpower.docqa.exception.ProviderException;
import com.purchasingpower.docqa.model.conversation.MemoryTurn;
import com.purchasingpower.docqa.service.GenerationService;
import com.purchasingpower.docqa.util.ProviderCallExecutor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class ProviderGenerationService implements GenerationService {

    private final LLMProviderFactory providerFactory;
    private final ProviderCallExecutor callExecutor;

    @Override
    public String generate(String prompt, List<MemoryTurn> history) {
        LLMProvider provider = providerFactory.getProvider();
        List<MemoryTurn> turns = history != null ? List.copyOf(history) : List.of();
        try {
            return callExecutor.execute(provider.getProviderName(), "generation",
                    () -> provider.generate(prompt, turns));
        } catch (ProviderException e) {
            throw new GenerationException("Answer generation failed: " + e.getMessage(), e.getAttempts(), e);
        }
    }
}
