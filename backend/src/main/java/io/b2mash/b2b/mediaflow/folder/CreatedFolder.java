package io.b2mash.b2b.mediaflow.folder;

public record CreatedFolder(
    String folderPath, String partnerFolderName, String folderToken, String uniqueKey) {}
