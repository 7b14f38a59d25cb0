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
import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Files;

/**
 * A script in a UTF-8 file.
 */
public class FileScriptSource
    implements ScriptSource
{
    private static final Charset UTF8 = Charset.forName("UTF-8");

    private final File file;

    public FileScriptSource(File file)
    {
        this.file = file.getAbsoluteFile();
    }

    @Override
    public String getName() {
        return file.getName();
    }

    @Override
    public String load()
        throws IOException
    {
        if (!file.isFile()) {
            throw new FileNotFoundException(file.getPath());
        }
        return new String(Files.readAllBytes(file.toPath()), UTF8);
    }

    @Override
    public File getFile() {
        return file;
    }

    @Override
    public String toString() {
        return file.getPath();
    }
}
