package com.duelo.engine;

import com.duelo.engine.model.JudgeCandidate;

import java.util.List;
import java.util.UUID;

/**
 * Supplies the texts a judge ranks. Contest storage lives outside the engine.
 */
public interface SubmissionSource {

    List<JudgeCandidate> findSubmissions(UUID contestId);
}
