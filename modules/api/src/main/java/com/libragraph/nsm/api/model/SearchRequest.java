package com.libragraph.nsm.api.model;

public record SearchRequest(String archive, String query, Boolean substring, Integer limit) {
}
