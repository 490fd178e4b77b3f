package com.duelo.engine;

import com.duelo.engine.model.JudgeCandidate;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Default submission source for local runs; a deployment replaces it with a {@code @Primary} bean
 * reading the contest store.
 */
@Component
public class InMemorySubmissionSource implements SubmissionSource {

    private final Map<UUID, List<JudgeCandidate>> submissions = new ConcurrentHashMap<>();

    public void register(UUID contestId, List<JudgeCandidate> candidates) {
        submissions.put(contestId, List.copyOf(candidates));
    }

    public void clear(UUID contestId) {
        submissions.remove(contestId);
    }

    @Override
    public List<JudgeCandidate> findSubmissions(UUID contestId) {
        return submissions.getOrDefault(contestId, List.of());
    }
}
