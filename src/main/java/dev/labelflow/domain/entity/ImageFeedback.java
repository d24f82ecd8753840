package dev.labelflow.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import java.util.Objects;
import java.util.UUID;

/** Free-text reviewer note on one image; independent of flagging. */
@Embeddable
public class ImageFeedback {

    @Column(name = "image_id", nullable = false)
    private UUID imageId;

    @Column(nullable = false, length = 4000)
    private String feedback;

    protected ImageFeedback() {
    }

    public ImageFeedback(UUID imageId, String feedback) {
        this.imageId = Objects.requireNonNull(imageId, "imageId");
        this.feedback = Objects.requireNonNull(feedback, "feedback");
    }

    public UUID getImageId() {
        return imageId;
    }

    public String getFeedback() {
        return feedback;
    }
}
