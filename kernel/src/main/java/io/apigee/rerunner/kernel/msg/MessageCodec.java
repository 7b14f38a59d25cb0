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
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Map;

/**
 * The canonical binary form of an output message. The same form, minus the metadata, is the input
 * to the content hash, so it must never depend on anything but the message content.
 * <p>
 * Layout: a version byte, the kind name, the attribute count followed by name/value pairs in
 * sorted order, the body length (-1 if there is no body) and the body, and finally, if requested,
 * the delta ID and the cacheable flag. Strings are a four-byte length followed by UTF-8 bytes.
 * </p>
 */
public class MessageCodec
{
    public static final byte VERSION = 1;

    private static final Charset UTF8 = Charset.forName("UTF-8");
    private static final int INIT_SIZE = 64;
    private static final char[] HEX = "0123456789abcdef".toCharArray();

    public static ByteBuffer encode(OutputMessage msg, boolean includeMetadata)
    {
        ByteBuffer bb = ByteBuffer.allocate(Math.max(INIT_SIZE, msg.getBodyLength() + INIT_SIZE));
        bb = ensure(bb, 1);
        bb.put(VERSION);
        bb = putString(bb, msg.getKind().name());

        bb = ensure(bb, 4);
        bb.putInt(msg.getAttributes().size());
        for (Map.Entry<String, String> e : msg.getAttributes().entrySet()) {
            bb = putString(bb, e.getKey());
            bb = putString(bb, e.getValue());
        }

        ByteBuffer body = msg.getBody();
        if (body == null) {
            bb = ensure(bb, 4);
            bb.putInt(-1);
        } else {
            bb = ensure(bb, 4 + body.remaining());
            bb.putInt(body.remaining());
            bb.put(body);
        }

        if (includeMetadata) {
            bb = ensure(bb, 5);
            bb.putInt(msg.getMetadata().getDeltaId());
            bb.put((byte)(msg.getMetadata().isCacheable() ? 1 : 0));
        }

        bb.flip();
        return bb;
    }

    public static int encodedSize(OutputMessage msg, boolean includeMetadata)
    {
        int len = 1 + stringSize(msg.getKind().name()) + 4;
        for (Map.Entry<String, String> e : msg.getAttributes().entrySet()) {
            len += stringSize(e.getKey()) + stringSize(e.getValue());
        }
        len += 4 + msg.getBodyLength();
        if (includeMetadata) {
            len += 5;
        }
        return len;
    }

    /**
     * Compute the MD5 digest of the message content in lower-case hex. MD5 is fine here, since we
     * need uniqueness and not security.
     */
    public static String hash(OutputMessage msg)
    {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("MD5");
        } catch (NoSuchAlgorithmException nse) {
            throw new AssertionError("MD5 digest not available: " + nse);
        }
        digest.update(encode(msg, false));
        return toHex(digest.digest());
    }

    static String toHex(byte[] bytes)
    {
        char[] out = new char[bytes.length * 2];
        for (int i = 0; i < bytes.length; i++) {
            int v = bytes[i] & 0xff;
            out[i * 2] = HEX[v >>> 4];
            out[(i * 2) + 1] = HEX[v & 0xf];
        }
        return new String(out);
    }

    private static int stringSize(String s)
    {
        return 4 + s.getBytes(UTF8).length;
    }

    private static ByteBuffer putString(ByteBuffer b, String s)
    {
        byte[] bytes = s.getBytes(UTF8);
        ByteBuffer bb = ensure(b, 4 + bytes.length);
        bb.putInt(bytes.length);
        bb.put(bytes);
        return bb;
    }

    private static ByteBuffer ensure(ByteBuffer b, int needed)
    {
        ByteBuffer bb = b;
        while (bb.remaining() < needed) {
            int newCap = Math.max(bb.capacity() * 2, 1);
            ByteBuffer d = ByteBuffer.allocate(newCap);
            bb.flip();
            d.put(bb);
            bb = d;
        }
        return bb;
    }
}
