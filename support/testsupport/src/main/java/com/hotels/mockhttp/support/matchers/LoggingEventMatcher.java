/*
  Copyright (C) 2013-2024 Expedia Inc.

  Licensed under the Apache License, Version 2.0 (the "License");
  you may not use this file except in compliance with the License.
  You may obtain a copy of the License at

  http://www.apache.org/licenses/LICENSE-2.0

  Unless required by applicable law or agreed to in writing, software
  distributed under the License is distributed on an "AS IS" BASIS,
  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
  See the License for the specific language governing permissions and
  limitations under the License.
 */
package com.hotels.mockhttp.support.matchers;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.IThrowableProxy;
import org.hamcrest.Description;
import org.hamcrest.Matcher;
import org.hamcrest.TypeSafeMatcher;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Matches a logback event by level, message pattern and, optionally, the attached exception.
 * Messages are matched as regular expressions.
 */
public final class LoggingEventMatcher extends TypeSafeMatcher<ILoggingEvent> {
    private final Level level;
    private final Matcher<String> message;
    private final Class<? extends Throwable> exceptionClass;

    private LoggingEventMatcher(Level level, String message, Class<? extends Throwable> exceptionClass) {
        this.level = requireNonNull(level);
        this.message = new RegExMatcher(message);
        this.exceptionClass = exceptionClass;
    }

    /**
     * Matches a log event that carries no exception.
     *
     * @param level   Log level
     * @param message Log message pattern
     * @return matcher
     */
    public static Matcher<ILoggingEvent> loggingEvent(Level level, String message) {
        return new LoggingEventMatcher(level, message, null);
    }

    /**
     * Matches a log event with an attached exception of the given class.
     *
     * @param level          Log level
     * @param message        Log message pattern
     * @param exceptionClass Exception class
     * @return matcher
     */
    public static Matcher<ILoggingEvent> loggingEvent(Level level, String message, Class<? extends Throwable> exceptionClass) {
        return new LoggingEventMatcher(level, message, requireNonNull(exceptionClass));
    }

    @Override
    protected boolean matchesSafely(ILoggingEvent event) {
        return level.equals(event.getLevel())
                && message.matches(event.getFormattedMessage())
                && exceptionMatches(event.getThrowableProxy());
    }

    private boolean exceptionMatches(IThrowableProxy throwableProxy) {
        return exceptionClass == null
                ? throwableProxy == null
                : throwableProxy != null && exceptionClass.getName().equals(throwableProxy.getClassName());
    }

    @Override
    protected void describeMismatchSafely(ILoggingEvent item, Description description) {
        description.appendText(format("loggingEvent(level=%s, message='%s'", item.getLevel(), item.getFormattedMessage()));
        IThrowableProxy throwableProxy = item.getThrowableProxy();
        if (throwableProxy != null) {
            description.appendText(format(" exception=%s", throwableProxy.getClassName()));
        }
        description.appendText(")");
    }

    @Override
    public void describeTo(Description description) {
        description.appendText(format("loggingEvent(level=%s, message=%s", level, message));
        if (exceptionClass != null) {
            description.appendText(format(" exception=%s", exceptionClass.getName()));
        }
        description.appendText(")");
    }
}
