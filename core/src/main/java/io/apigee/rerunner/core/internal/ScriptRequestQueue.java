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
package io.apigee.rerunner.core.internal;

import io.apigee.rerunner.core.ScriptRequest;
import io.apigee.rerunner.kernel.InputState;

import java.util.ArrayDeque;

/**
 * The FIFO queue of control requests for one session. It is shared between the session, which
 * adds requests, and the script controller, which removes them. All methods are synchronized
 * on the queue and none of them call out of it.
 */
public class ScriptRequestQueue
{
    private final ArrayDeque<Request> requests = new ArrayDeque<Request>();

    /**
     * Add a request. A RERUN that arrives while the last queued request is also a RERUN replaces
     * it, so that a burst of input changes results in a single run.
     */
    public synchronized void enqueue(ScriptRequest type, InputState state)
    {
        if (type == ScriptRequest.RERUN) {
            Request last = requests.peekLast();
            if ((last != null) && (last.getType() == ScriptRequest.RERUN)) {
                requests.pollLast();
                requests.addLast(new Request(ScriptRequest.RERUN,
                                             InputState.coalesce(last.getState(), state)));
                return;
            }
        }
        requests.addLast(new Request(type, type == ScriptRequest.RERUN ? state : null));
    }

    /**
     * Remove and return the first request, or null if there is none.
     */
    public synchronized Request dequeue()
    {
        return requests.pollFirst();
    }

    public synchronized boolean hasRequest()
    {
        return !requests.isEmpty();
    }

    public synchronized int size()
    {
        return requests.size();
    }

    public synchronized void clear()
    {
        requests.clear();
    }

    public static final class Request
    {
        private final ScriptRequest type;
        private final InputState state;

        Request(ScriptRequest type, InputState state)
        {
            this.type = type;
            this.state = state;
        }

        public ScriptRequest getType() {
            return type;
        }

        /**
         * The new input state of a RERUN, or null to rerun with the current one.
         */
        public InputState getState() {
            return state;
        }

        @Override
        public String toString()
        {
            return (state == null) ? type.toString() : type + " " + state;
        }
    }
}
