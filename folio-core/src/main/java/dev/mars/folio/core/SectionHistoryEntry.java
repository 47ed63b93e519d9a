/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.folio.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Objects;

/**
 * One completed generation attempt of a section.
 * <p>
 * The content itself is not kept; {@code content_snapshot_ref} is {@code sha256:<hex>} of it.
 * {@code feedback} is filled in when the reviewer rejects the attempt.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-03-02
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class SectionHistoryEntry implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String contentSnapshotRef;
    private final String modelName;
    private final Instant timestamp;
    private final int revision;
    private final String feedback;

    @JsonCreator
    public SectionHistoryEntry(
            @JsonProperty("content_snapshot_ref") String contentSnapshotRef,
            @JsonProperty("model_name") String modelName,
            @JsonProperty("timestamp") Instant timestamp,
            @JsonProperty("revision") int revision,
            @JsonProperty("feedback") String feedback) {
        this.contentSnapshotRef = contentSnapshotRef;
        this.modelName = modelName;
        this.timestamp = timestamp;
        this.revision = revision;
        this.feedback = feedback;
    }

    /**
     * Records an attempt that produced {@code content} under the given revision.
     */
    public static SectionHistoryEntry forContent(String content, String modelName, Instant timestamp, int revision) {
        return new SectionHistoryEntry(snapshotRef(content), modelName, timestamp, revision, null);
    }

    /**
     * Computes the snapshot reference of a piece of content.
     *
     * @param content the generated text
     * @return {@code sha256:} followed by the lowercase hex digest of the UTF-8 bytes
     */
    public static String snapshotRef(String content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest((content != null ? content : "").getBytes(StandardCharsets.UTF_8));
            return "sha256:" + HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Returns a copy carrying the reviewer feedback that rejected this attempt.
     */
    public SectionHistoryEntry withFeedback(String newFeedback) {
        return new SectionHistoryEntry(contentSnapshotRef, modelName, timestamp, revision, newFeedback);
    }

    @JsonProperty("content_snapshot_ref")
    public String getContentSnapshotRef() {
        return contentSnapshotRef;
    }

    @JsonProperty("model_name")
    public String getModelName() {
        return modelName;
    }

    @JsonProperty("timestamp")
    public Instant getTimestamp() {
        return timestamp;
    }

    @JsonProperty("revision")
    public int getRevision() {
        return revision;
    }

    @JsonProperty("feedback")
    public String getFeedback() {
        return feedback;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SectionHistoryEntry that = (SectionHistoryEntry) o;
        return revision == that.revision &&
               Objects.equals(contentSnapshotRef, that.contentSnapshotRef) &&
               Objects.equals(modelName, that.modelName) &&
               Objects.equals(timestamp, that.timestamp) &&
               Objects.equals(feedback, that.feedback);
    }

    @Override
    public int hashCode() {
        return Objects.hash(contentSnapshotRef, modelName, timestamp, revision, feedback);
    }

    @Override
    public String toString() {
        return "SectionHistoryEntry{" +
               "ref='" + contentSnapshotRef + '\'' +
               ", model='" + modelName + '\'' +
               ", revision=" + revision +
               ", timestamp=" + timestamp +
               '}';
    }
}
