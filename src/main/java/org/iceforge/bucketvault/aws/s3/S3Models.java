package org.iceforge.bucketvault.aws.s3;

import com.fasterxml.jackson.annotation.JsonProperty;

public final class S3Models {

    private S3Models() {}

    /** One entry of a bucket listing. creationDate is ISO-8601 or null. */
    public record BucketDescriptor(
            @JsonProperty("Name") String name,
            @JsonProperty("CreationDate") String creationDate
    ) {}

    public record ObjectKey(String key) {}

    public record ObjectVersionKey(String key, String versionId) {}

    public record EmptyResult(
            int objectsDeleted,
            int versionsDeleted,
            int deleteMarkersDeleted
    ) {}
}
