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

/**
 * Delivery information that travels with a message but is not part of its content. Two messages
 * with different metadata and the same content have the same hash.
 */
public final class MessageMetadata
{
    public static final int NO_DELTA_ID = -1;

    public static final MessageMetadata EMPTY = new MessageMetadata(NO_DELTA_ID, false);

    private final int deltaId;
    private final boolean cacheable;

    public MessageMetadata(int deltaId, boolean cacheable)
    {
        this.deltaId = deltaId;
        this.cacheable = cacheable;
    }

    /**
     * The position of a script output within its run, or NO_DELTA_ID for markers.
     */
    public int getDeltaId() {
        return deltaId;
    }

    /**
     * Whether the delivery layer decided to keep this message in the message cache.
     */
    public boolean isCacheable() {
        return cacheable;
    }

    public MessageMetadata withCacheable(boolean c)
    {
        if (c == cacheable) {
            return this;
        }
        return new MessageMetadata(deltaId, c);
    }

    public MessageMetadata withDeltaId(int id)
    {
        return new MessageMetadata(id, cacheable);
    }

    @Override
    public boolean equals(Object o)
    {
        if (!(o instanceof MessageMetadata)) {
            return false;
        }
        MessageMetadata m = (MessageMetadata)o;
        return (deltaId == m.deltaId) && (cacheable == m.cacheable);
    }

    @Override
    public int hashCode()
    {
        return (deltaId * 31) + (cacheable ? 1 : 0);
    }

    @Override
    public String toString()
    {
        return "{deltaId=" + deltaId + ", cacheable=" + cacheable + '}';
    }
}
