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
package io.apigee.rerunner.core;

import java.io.File;
import java.io.FileNotFoundException;

/**
 * A script held in memory. The text may be replaced at any time, which is handy for embedding
 * applications that edit scripts themselves. A null text behaves like a missing file.
 */
public class StringScriptSource
    implements ScriptSource
{
    private final String name;
    private volatile String script;

    public StringScriptSource(String name, String script)
    {
        this.name = name;
        this.script = script;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String load()
        throws FileNotFoundException
    {
        String s = script;
        if (s == null) {
            throw new FileNotFoundException(name);
        }
        return s;
    }

    public void setScript(String script) {
        this.script = script;
    }

    @Override
    public File getFile() {
        return null;
    }
}
