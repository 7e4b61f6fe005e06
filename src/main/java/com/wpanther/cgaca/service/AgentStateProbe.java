package com.wpanther.cgaca.service;

import com.wpanther.cgaca.dto.verification.LiveAgentState;
import com.wpanther.cgaca.dto.verification.VerificationTarget;
import com.wpanther.cgaca.entity.CertificateRecord;

/**
 * Reaches a running agent and reports what it is actually running.
 * Implementations decide how the agent is contacted; any exception counts as a failed verification.
 */
public interface AgentStateProbe {

    /**
     * @param certificate the certificate the agent claims to hold
     * @param target      the verification request, including caller address and action
     * @return the live golden thread hash and the outcome of each named check
     */
    LiveAgentState probe(CertificateRecord certificate, VerificationTarget target);
}
