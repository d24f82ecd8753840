package dev.labelflow.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import java.util.Objects;
import java.util.UUID;

/** An image a reviewer sent back, with the reason shown to the annotator. */
@Embeddable
public class FlaggedImage {

    @Column(name = "image_id", nullable = false)
    private UUID imageId;

    @Column(length = 2000)
    private String reason;

    protected FlaggedImage() {
    }

    public FlaggedImage(UUID imageId, String reason) {
        this.imageId = Objects.requireNonNull(imageId, "imageId");
        this.reason = reason == null ? "" : reason;
    }

    public UUID getImageId() {
        return imageId;
    }

    public String getReason() {
        return reason;
    }
}
