package org.iceforge.bucketvault.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.iceforge.bucketvault.aws.s3.S3Models;

import java.util.List;

public final class BucketApiModels {

    private BucketApiModels() {}

    public record MessageResponse(String message) {}

    public record BucketNameSuggestion(
            @JsonProperty("suggested_bucket_name") String suggestedBucketName
    ) {}

    public record CreateBucketRequest(
            @JsonProperty("bucket_name") String bucketName
    ) {}

    public record BucketListResponse(List<S3Models.BucketDescriptor> buckets) {}
}
