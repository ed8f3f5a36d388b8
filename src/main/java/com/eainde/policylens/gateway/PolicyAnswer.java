package com.eainde.policylens.gateway;

/**
 * Answer to a free-text compliance question.
 */
public record PolicyAnswer(String answer, double confidence) {}
