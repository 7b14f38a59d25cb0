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
package io.apigee.rerunner.core.test;

import io.apigee.rerunner.core.ScriptRequest;
import io.apigee.rerunner.core.internal.ScriptRequestQueue;
import io.apigee.rerunner.kernel.InputState;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class ScriptRequestQueueTest
{
    private ScriptRequestQueue queue;

    @Before
    public void createQueue()
    {
        queue = new ScriptRequestQueue();
    }

    @Test
    public void testEmpty()
    {
        assertFalse(queue.hasRequest());
        assertNull(queue.dequeue());
    }

    @Test
    public void testRerunsCoalesce()
    {
        InputState a = InputState.builder().put("x", "a").build();
        InputState b = InputState.builder().put("x", "b").build();
        queue.enqueue(ScriptRequest.RERUN, a);
        queue.enqueue(ScriptRequest.RERUN, b);

        assertEquals(1, queue.size());
        ScriptRequestQueue.Request r = queue.dequeue();
        assertEquals(ScriptRequest.RERUN, r.getType());
        assertEquals(b, r.getState());
    }

    @Test
    public void testCoalesceKeepsTriggers()
    {
        InputState clicked = InputState.builder().put("x", "a").trigger("go").build();
        InputState typed = InputState.builder().put("x", "b").build();
        queue.enqueue(ScriptRequest.RERUN, clicked);
        queue.enqueue(ScriptRequest.RERUN, typed);

        InputState merged = queue.dequeue().getState();
        assertEquals("b", merged.get("x"));
        assertTrue(merged.isTriggered("go"));
    }

    @Test
    public void testCoalesceWithoutNewState()
    {
        InputState a = InputState.builder().put("x", "a").build();
        queue.enqueue(ScriptRequest.RERUN, a);
        queue.enqueue(ScriptRequest.RERUN, null);
        assertEquals(a, queue.dequeue().getState());
    }

    @Test
    public void testOnlyTailCoalesces()
    {
        queue.enqueue(ScriptRequest.RERUN, null);
        queue.enqueue(ScriptRequest.STOP, null);
        queue.enqueue(ScriptRequest.RERUN, null);
        assertEquals(3, queue.size());

        assertEquals(ScriptRequest.RERUN, queue.dequeue().getType());
        assertEquals(ScriptRequest.STOP, queue.dequeue().getType());
        assertEquals(ScriptRequest.RERUN, queue.dequeue().getType());
        assertFalse(queue.hasRequest());
    }

    @Test
    public void testShutdownKeepsItsPlace()
    {
        queue.enqueue(ScriptRequest.RERUN, null);
        queue.enqueue(ScriptRequest.SHUTDOWN, InputState.EMPTY);
        queue.enqueue(ScriptRequest.RERUN, null);

        assertEquals(ScriptRequest.RERUN, queue.dequeue().getType());
        ScriptRequestQueue.Request r = queue.dequeue();
        assertEquals(ScriptRequest.SHUTDOWN, r.getType());
        assertNull(r.getState());
        assertEquals(ScriptRequest.RERUN, queue.dequeue().getType());
    }

    @Test
    public void testClear()
    {
        queue.enqueue(ScriptRequest.RERUN, null);
        queue.enqueue(ScriptRequest.STOP, null);
        queue.clear();
        assertEquals(0, queue.size());
    }
}
