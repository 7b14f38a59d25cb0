/**
 * Copyright 2013 Apigee Corporation.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */
package io.apigee.rerunner.kernel.msg;

import java.nio.ByteBuffer;
import java.nio.charset.Charset;
import java.util.Collections;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * A single unit of output that is delivered to a viewer. Messages are immutable. The content of a message
 * is its kind, its attributes and its optional body, and the content is what the hash identifies.
 * The metadata is carried alongside and is excluded from the hash.
 */
public final class OutputMessage
{
    public static final String REF_HASH = "refHash";

    private static final Charset UTF8 = Charset.forName("UTF-8");

    private final MessageKind kind;
    private final SortedMap<String, String> attributes;
    private final ByteBuffer body;
    private final MessageMetadata metadata;

    private volatile String hash;

    private OutputMessage(MessageKind kind, SortedMap<String, String> attributes,
                          ByteBuffer body, MessageMetadata metadata, String hash)
    {
        this.kind = kind;
        this.attributes = attributes;
        this.body = body;
        this.metadata = metadata;
        this.hash = hash;
    }

    public static Builder builder(MessageKind kind)
    {
        return new Builder(kind);
    }

    public MessageKind getKind() {
        return kind;
    }

    public String getAttribute(String name) {
        return attributes.get(name);
    }

    public SortedMap<String, String> getAttributes() {
        return attributes;
    }

    public boolean hasBody() {
        return body != null;
    }

    /**
     * Return a view of the body that the caller may read without affecting the message, or null.
     */
    public ByteBuffer getBody()
    {
        return (body == null ? null : body.duplicate());
    }

    public int getBodyLength()
    {
        return (body == null ? 0 : body.remaining());
    }

    public String getBodyString()
    {
        if (body == null) {
            return null;
        }
        ByteBuffer b = body.duplicate();
        byte[] bytes = new byte[b.remaining()];
        b.get(bytes);
        return new String(bytes, UTF8);
    }

    public MessageMetadata getMetadata() {
        return metadata;
    }

    /**
     * Return the content hash, computing it the first time it is needed.
     */
    public String getHash()
    {
        String h = hash;
        if (h == null) {
            h = MessageCodec.hash(this);
            hash = h;
        }
        return h;
    }

    /**
     * Return a copy of this message with different metadata. The copy shares the content, so it also
     * shares the hash.
     */
    public OutputMessage withMetadata(MessageMetadata md)
    {
        if (md.equals(metadata)) {
            return this;
        }
        return new OutputMessage(kind, attributes, body, md, hash);
    }

    /**
     * Create a small message that points to this one by hash, with a copy of this message's metadata.
     */
    public OutputMessage createReference()
    {
        return builder(MessageKind.REFERENCE)
            .attribute(REF_HASH, getHash())
            .metadata(metadata)
            .build();
    }

    /**
     * The number of bytes this message occupies in its canonical encoding, metadata included.
     */
    public int getEncodedSize()
    {
        return MessageCodec.encodedSize(this, true);
    }

    @Override
    public String toString()
    {
        StringBuilder s = new StringBuilder();
        s.append(kind).append(attributes);
        if (body != null) {
            s.append(" body=").append(body.remaining()).append(" bytes");
        }
        s.append(' ').append(metadata);
        return s.toString();
    }

    public static final class Builder
    {
        private final MessageKind kind;
        private final TreeMap<String, String> attributes = new TreeMap<String, String>();
        private ByteBuffer body;
        private MessageMetadata metadata = MessageMetadata.EMPTY;

        Builder(MessageKind kind)
        {
            if (kind == null) {
                throw new IllegalArgumentException("kind");
            }
            this.kind = kind;
        }

        public Builder attribute(String name, String value)
        {
            if (value != null) {
                attributes.put(name, value);
            }
            return this;
        }

        public Builder attribute(String name, int value)
        {
            attributes.put(name, String.valueOf(value));
            return this;
        }

        public Builder attribute(String name, boolean value)
        {
            attributes.put(name, String.valueOf(value));
            return this;
        }

        /**
         * Set the body. The remaining bytes of the buffer are copied.
         */
        public Builder body(ByteBuffer b)
        {
            if (b == null) {
                this.body = null;
            } else {
                ByteBuffer copy = ByteBuffer.allocate(b.remaining());
                copy.put(b.duplicate());
                copy.flip();
                this.body = copy.asReadOnlyBuffer();
            }
            return this;
        }

        public Builder body(byte[] b)
        {
            return body(b == null ? null : ByteBuffer.wrap(b));
        }

        public Builder body(String s)
        {
            return body(s == null ? null : s.getBytes(UTF8));
        }

        public Builder metadata(MessageMetadata md)
        {
            this.metadata = (md == null ? MessageMetadata.EMPTY : md);
            return this;
        }

        public Builder deltaId(int id)
        {
            this.metadata = metadata.withDeltaId(id);
            return this;
        }

        public OutputMessage build()
        {
            SortedMap<String, String> attrs =
                Collections.unmodifiableSortedMap(new TreeMap<String, String>(attributes));
            return new OutputMessage(kind, attrs, body, metadata, null);
        }
    }
}
