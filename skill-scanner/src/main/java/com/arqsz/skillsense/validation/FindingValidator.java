package com.arqsz.skillsense.validation;

import com.arqsz.skillsense.model.ValidatedSecurity;

/**
 * External judgment service that reviews deterministic findings.
 * Implementations validate only the submitted findings and never add new ones.
 */
public interface FindingValidator {

    /**
     * Validates the findings of a request
     * 
     * @param request Findings, counts, score and context to judge
     * @return Verdicts plus a short security summary
     * @throws ValidationException on transport, timeout, parse or schema failure
     */
    ValidatedSecurity validate(ValidationRequest request) throws ValidationException;
}
