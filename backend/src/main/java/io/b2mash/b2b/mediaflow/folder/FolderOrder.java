package io.b2mash.b2b.mediaflow.folder;

/** Requested position of one folder; lower values are shown first. */
public record FolderOrder(String uniqueKey, int displayOrder) {}
