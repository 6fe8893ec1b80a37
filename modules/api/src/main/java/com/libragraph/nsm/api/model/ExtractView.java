package com.libragraph.nsm.api.model;

import com.libragraph.nsm.core.archive.EntryFailure;
import com.libragraph.nsm.core.archive.ExtractResult;

import java.util.List;

public record ExtractView(
        String destination,
        List<String> extracted,
        List<Failure> failures,
        long bytesWritten,
        boolean complete
) {
    public record Failure(String path, String error, String message) {
        static Failure of(EntryFailure failure) {
            return new Failure(failure.path(), failure.error().name(), failure.message());
        }
    }

    public static ExtractView of(ExtractResult result) {
        return new ExtractView(
                result.destination().toString(),
                result.extracted(),
                result.failures().stream().map(Failure::of).toList(),
                result.bytesWritten(),
                result.complete());
    }
}
