package com.eainde.policylens.policy;

/**
 * @param docId      id assigned to the stored version
 * @param title      document title
 * @param version    version label
 * @param chunkCount chunks indexed
 */
public record PolicyIngestion(String docId, String title, String version, int chunkCount) {}
