package com.eainde.admission.model;

/**
 * Why an application ended in {@link ApplicationStage#ERROR}.
 *
 * @param stage  the stage that was running when the failure happened
 * @param detail human readable cause
 */
public record StageFailure(ApplicationStage stage, String detail) {}
