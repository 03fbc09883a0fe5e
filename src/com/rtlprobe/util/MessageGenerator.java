/*
 *
 * Copyright (c) 2025, The RTLProbe Authors.
 * All rights reserved.
 *
 * This file is part of RTLProbe.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 */

package com.rtlprobe.util;

/**
 * Central place for console output of the command line tools and passes.
 * Informational messages go to standard out, errors and warnings to
 * standard error.
 */
public class MessageGenerator {

    private static final int HEADER_WIDTH = 72;

    /**
     * Prints a message to standard out.
     * @param msg The message to print.
     */
    public static void briefMessage(String msg) {
        System.out.println(msg);
    }

    /**
     * Prints a message to standard out, but only if verbose output was
     * requested.
     * @param verbose Whether to print at all.
     * @param msg The message to print.
     */
    public static void verboseMessage(boolean verbose, String msg) {
        if (verbose) {
            System.out.println(msg);
        }
    }

    public static void briefWarning(String msg) {
        System.err.println(msg.startsWith("WARNING:") ? msg : "WARNING: " + msg);
    }

    /**
     * Prints an error message to standard error.
     * @param msg The message to print.
     */
    public static void briefError(String msg) {
        System.err.println(msg);
    }

    /**
     * Prints an error message to standard error and exits the program with
     * a non-zero return value.
     * @param msg The message to print.
     */
    public static void briefErrorAndExit(String msg) {
        briefError(msg);
        System.exit(1);
    }

    /**
     * Prints a generic header to standard out to separate operations.
     * @param s Title of the header
     */
    public static void printHeader(String s) {
        String bar = makeRepeated('=', HEADER_WIDTH + 6);
        double whiteSpace = (HEADER_WIDTH - s.length()) / 2.0;
        String left = makeWhiteSpace((int) whiteSpace);
        String right = makeWhiteSpace((int) (whiteSpace + 0.5));
        System.out.println(bar);
        System.out.println("== " + left + s + right + " ==");
        System.out.println(bar);
    }

    /**
     * Creates a whitespace string with length number of spaces.
     * @param length Number of spaces in the string.
     * @return The newly created whitespace string.
     */
    public static String makeWhiteSpace(int length) {
        return makeRepeated(' ', length);
    }

    private static String makeRepeated(char c, int length) {
        if (length < 1) return "";
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(c);
        }
        return sb.toString();
    }
}
