package jobrelay.relay.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Fixed set of long-running job categories.
 * Each kind owns exactly one slot in the registry; kinds never share a slot.
 */
public enum JobKind {
    /** AI title generation for every photo missing a title */
    AI_TITLES("ai-titles", "AI title generation", "AI Titles", "ai-titles", true),
    /** Regenerates video master playlists with the current configuration */
    VIDEO_OPTIMIZE("video-optimize", "Video playlist regeneration", "Video Processing", "video-optimization", false),
    /** Re-encodes every video with the current quality settings */
    VIDEO_REPROCESS("video-reprocess", "Video reprocessing", "Video Reprocessing", "video-reprocessing", false);

    private final String id;
    private final String displayName;
    private final String notificationPrefix;
    private final String notificationTag;
    private final boolean titleUpdates;

    JobKind(String id, String displayName, String notificationPrefix, String notificationTag,
            boolean titleUpdates) {
        this.id = id;
        this.displayName = displayName;
        this.notificationPrefix = notificationPrefix;
        this.notificationTag = notificationTag;
        this.titleUpdates = titleUpdates;
    }

    /** Identifier used in URLs and JSON */
    @JsonValue
    public String id() {
        return id;
    }

    public String displayName() {
        return displayName;
    }

    public String notificationPrefix() {
        return notificationPrefix;
    }

    public String notificationTag() {
        return notificationTag;
    }

    /** Whether the program of this kind emits {@code TITLE_UPDATE:} markers */
    public boolean supportsTitleUpdates() {
        return titleUpdates;
    }

    /**
     * Resolve a kind from its URL identifier.
     *
     * @throws IllegalArgumentException if the id is not a known kind
     */
    public static JobKind fromId(String id) {
        for (JobKind kind : values()) {
            if (kind.id.equals(id)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("unknown job kind: " + id);
    }

    @Override
    public String toString() {
        return id;
    }
}
