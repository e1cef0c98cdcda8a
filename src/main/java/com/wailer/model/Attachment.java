package com.wailer.model;

import java.util.Arrays;
import java.util.Objects;

/** A file attached to an outgoing email. */
public final class Attachment {

    private final String filename;
    private final String contentType;
    private final byte[] content;

    public Attachment(final String filename, final String contentType, final byte[] content) {
        this.filename    = Objects.requireNonNull(filename, "filename");
        this.contentType = Objects.requireNonNull(contentType, "contentType");
        this.content     = Objects.requireNonNull(content, "content").clone();
    }

    public String getFilename()    { return filename; }
    public String getContentType() { return contentType; }
    public byte[] getContent()     { return content.clone(); }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (!(o instanceof Attachment)) return false;
        final Attachment that = (Attachment) o;
        return filename.equals(that.filename)
            && contentType.equals(that.contentType)
            && Arrays.equals(content, that.content);
    }

    @Override
    public int hashCode() {
        return Objects.hash(filename, contentType) * 31 + Arrays.hashCode(content);
    }

    @Override
    public String toString() {
        return "Attachment{filename=" + filename + ", contentType=" + contentType
             + ", size=" + content.length + "}";
    }
}
