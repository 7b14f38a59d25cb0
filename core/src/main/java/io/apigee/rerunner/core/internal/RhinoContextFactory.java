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

import org.mozilla.javascript.ClassShutter;
import org.mozilla.javascript.Context;
import org.mozilla.javascript.ContextFactory;

import java.util.HashSet;

/**
 * Creates the Rhino contexts that scripts run in. Scripts are interpreted so that Rhino counts
 * instructions, and every so often the count gives the running controller a chance to look for
 * control requests.
 */
public class RhinoContextFactory
    extends ContextFactory
{
    public static final int DEFAULT_JS_VERSION = Context.VERSION_ES6;
    // Instruction counting only works in interpreted mode
    public static final int INTERPRETED = -1;

    private static final ClassShutter DEFAULT_SHUTTER = new OpaqueClassShutter();

    private int jsVersion = DEFAULT_JS_VERSION;
    private int instructionThreshold;

    @Override
    protected Context makeContext()
    {
        Context c = super.makeContext();
        c.setLanguageVersion(jsVersion);
        c.setOptimizationLevel(INTERPRETED);
        c.setGenerateObserverCount(instructionThreshold > 0);
        if (instructionThreshold > 0) {
            c.setInstructionObserverThreshold(instructionThreshold);
        }
        c.setClassShutter(DEFAULT_SHUTTER);
        return c;
    }

    /**
     * Rhino calls this every "instruction threshold" instructions. If a controller is running a
     * script on this thread then it may throw a control signal from here.
     */
    @Override
    protected void observeInstructionCount(Context cx, int count)
    {
        ScriptController controller = (ScriptController)cx.getThreadLocal(ScriptController.CONTROLLER);
        if (controller != null) {
            controller.requestInterruptCheck();
        }
    }

    @Override
    protected boolean hasFeature(Context cx, int i)
    {
        switch (i) {
        case Context.FEATURE_LOCATION_INFORMATION_IN_ERROR:
            return true;
        case Context.FEATURE_ENHANCED_JAVA_ACCESS:
            // With this on, scripts could catch the signals that stop them
            return false;
        default:
            return super.hasFeature(cx, i);
        }
    }

    public int getJsVersion() {
        return jsVersion;
    }

    public void setJsVersion(int jsVersion) {
        this.jsVersion = jsVersion;
    }

    public int getInstructionThreshold() {
        return instructionThreshold;
    }

    /**
     * Set how many instructions run between checks for control requests. Zero turns the checks
     * off, so that only output and explicit checkpoints can interrupt a script.
     */
    public void setInstructionThreshold(int instructionThreshold) {
        this.instructionThreshold = instructionThreshold;
    }

    /**
     * Scripts get no access to Java classes, apart from the ones that Rhino needs in order to
     * report errors.
     */
    private static final class OpaqueClassShutter
        implements ClassShutter
    {
        private final HashSet<String> whitelist = new HashSet<String>();

        OpaqueClassShutter()
        {
            whitelist.add("org.mozilla.javascript.EcmaError");
            whitelist.add("org.mozilla.javascript.EvaluatorException");
            whitelist.add("org.mozilla.javascript.JavaScriptException");
            whitelist.add("org.mozilla.javascript.RhinoException");
            whitelist.add("java.lang.Boolean");
            whitelist.add("java.lang.Double");
            whitelist.add("java.lang.Exception");
            whitelist.add("java.lang.Integer");
            whitelist.add("java.lang.Long");
            whitelist.add("java.lang.Object");
            whitelist.add("java.lang.Number");
            whitelist.add("java.lang.String");
            whitelist.add("java.lang.Throwable");
        }

        @Override
        public boolean visibleToScripts(String s)
        {
            return whitelist.contains(s);
        }
    }
}
