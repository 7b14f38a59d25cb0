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

import io.apigee.rerunner.kernel.msg.OutputMessage;
import io.apigee.rerunner.kernel.msg.OutputMessages;
import org.mozilla.javascript.RhinoException;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.NoSuchFileException;

/**
 * The script could not be turned into something runnable, either because its source could not be
 * read or because it does not parse.
 */
public class ScriptCompileException
    extends RerunnerException
{
    public static final String SYNTAX_ERROR = "SyntaxError";
    public static final String NOT_FOUND = "ScriptNotFound";
    public static final String UNREADABLE = "ScriptUnreadable";

    private final String errorType;
    private final String sourceName;
    private final int line;
    private final int column;

    public ScriptCompileException(String errorType, String msg, String sourceName,
                                  int line, int column, Throwable cause)
    {
        super(msg, cause);
        this.errorType = errorType;
        this.sourceName = sourceName;
        this.line = line;
        this.column = column;
    }

    public static ScriptCompileException fromParseError(RhinoException re)
    {
        return new ScriptCompileException(SYNTAX_ERROR, re.details(), re.sourceName(),
                                          re.lineNumber(), re.columnNumber(), re);
    }

    public static ScriptCompileException fromLoadError(String sourceName, IOException ioe)
    {
        boolean notFound = (ioe instanceof FileNotFoundException) || (ioe instanceof NoSuchFileException);
        String msg = (notFound ? "Script not found: " : "Cannot read script: ") + sourceName;
        return new ScriptCompileException(notFound ? NOT_FOUND : UNREADABLE, msg, sourceName, 0, 0, ioe);
    }

    public String getErrorType() {
        return errorType;
    }

    public String getSourceName() {
        return sourceName;
    }

    /**
     * The line of the error, or zero if it is not known.
     */
    public int getLine() {
        return line;
    }

    /**
     * The column of the error, or zero if it is not known.
     */
    public int getColumn() {
        return column;
    }

    /**
     * Describe this error to the viewer.
     */
    public OutputMessage toMessage()
    {
        return OutputMessages.compileError(errorType, getMessage(), line, column);
    }
}
