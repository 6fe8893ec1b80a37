package com.libragraph.nsm.api.model;

public record ArchiveRef(String archive) {
}
