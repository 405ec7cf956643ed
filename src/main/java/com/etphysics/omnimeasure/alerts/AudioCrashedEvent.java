package com.etphysics.omnimeasure.alerts;

/** Published when the capture thread died from an uncaught throwable. */
public record AudioCrashedEvent(Throwable cause) {}
