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

import io.apigee.rerunner.kernel.msg.OutputMessages;
import org.mozilla.javascript.Context;
import org.mozilla.javascript.Function;
import org.mozilla.javascript.NativeJSON;
import org.mozilla.javascript.Scriptable;
import org.mozilla.javascript.ScriptableObject;
import org.mozilla.javascript.Undefined;
import org.mozilla.javascript.annotations.JSFunction;
import org.mozilla.javascript.annotations.JSGetter;

import java.lang.reflect.InvocationTargetException;

/**
 * The "st" object that scripts use to produce output and to read the state of the viewer's
 * inputs. Every function works on the controller that is running the current thread's script.
 */
public class ScriptApi
{
    public static final String GLOBAL_NAME = "st";

    /**
     * Define the "st" object in the specified global scope.
     */
    public static void install(Context cx, ScriptableObject global)
        throws InvocationTargetException, IllegalAccessException, InstantiationException
    {
        ScriptableObject.defineClass(global, ApiImpl.class);
        Scriptable st = cx.newObject(global, ApiImpl.CLASS_NAME);
        ScriptableObject.defineProperty(global, GLOBAL_NAME, st,
                                        ScriptableObject.READONLY | ScriptableObject.PERMANENT);
    }

    static ScriptController getController(Context cx)
    {
        ScriptController c = (ScriptController)cx.getThreadLocal(ScriptController.CONTROLLER);
        if (c == null) {
            throw Context.reportRuntimeError("No script is running on this thread");
        }
        return c;
    }

    private static String joinArgs(Object[] args)
    {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < args.length; i++) {
            if (i > 0) {
                sb.append(' ');
            }
            sb.append(Context.toString(args[i]));
        }
        return sb.toString();
    }

    private static String idArg(Object[] args)
    {
        if ((args.length < 1) || Undefined.isUndefined(args[0]) || (args[0] == null)) {
            throw Context.reportRuntimeError("A widget id is required");
        }
        return Context.toString(args[0]);
    }

    public static class ApiImpl
        extends ScriptableObject
    {
        public static final String CLASS_NAME = "_rerunnerApiClass";

        @Override
        public String getClassName() {
            return CLASS_NAME;
        }

        @JSFunction
        @SuppressWarnings("unused")
        public static void write(Context cx, Scriptable thisObj, Object[] args, Function func)
        {
            getController(cx).emitElement(OutputMessages.ELEMENT_TEXT, joinArgs(args));
        }

        @JSFunction
        @SuppressWarnings("unused")
        public static void markdown(Context cx, Scriptable thisObj, Object[] args, Function func)
        {
            getController(cx).emitElement(OutputMessages.ELEMENT_MARKDOWN, joinArgs(args));
        }

        @JSFunction
        @SuppressWarnings("unused")
        public static void error(Context cx, Scriptable thisObj, Object[] args, Function func)
        {
            getController(cx).emitElement(OutputMessages.ELEMENT_ERROR, joinArgs(args));
        }

        @JSFunction
        @SuppressWarnings("unused")
        public static void json(Context cx, Scriptable thisObj, Object[] args, Function func)
        {
            Object val = (args.length > 0) ? args[0] : Undefined.instance;
            Object str = NativeJSON.stringify(cx, ScriptableObject.getTopLevelScope(thisObj), val, null, null);
            getController(cx).emitElement(OutputMessages.ELEMENT_JSON,
                                          Undefined.isUndefined(str) ? "null" : Context.toString(str));
        }

        /**
         * Return the viewer's current value for an input, or the default if the viewer has not
         * set one.
         */
        @JSFunction
        @SuppressWarnings("unused")
        public static Object input(Context cx, Scriptable thisObj, Object[] args, Function func)
        {
            String id = idArg(args);
            Object val = getController(cx).getInputState().get(id);
            if (val != null) {
                return val;
            }
            return (args.length > 1) ? args[1] : Undefined.instance;
        }

        @JSFunction
        @SuppressWarnings("unused")
        public static boolean button(Context cx, Scriptable thisObj, Object[] args, Function func)
        {
            return getController(cx).getInputState().isTriggered(idArg(args));
        }

        @JSFunction
        @SuppressWarnings("unused")
        public static void checkpoint(Context cx, Scriptable thisObj, Object[] args, Function func)
        {
            getController(cx).requestInterruptCheck();
        }

        @JSGetter("runCount")
        @SuppressWarnings("unused")
        public int getRunCount()
        {
            return getController(Context.getCurrentContext()).getRunCount();
        }
    }
}
