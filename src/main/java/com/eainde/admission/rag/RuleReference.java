package com.eainde.admission.rag;

import com.eainde.admission.model.Citation;

/**
 * One rulebook passage returned by a free rule query.
 */
public record RuleReference(String chunkText, Citation citation, double similarity) {}
