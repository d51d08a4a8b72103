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
package com.hotels.mockhttp.support;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Context;
import ch.qos.logback.core.read.ListAppender;
import org.slf4j.LoggerFactory;

import java.util.List;

import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.joining;
import static java.util.stream.Collectors.toList;
import static org.slf4j.LoggerFactory.getLogger;

/**
 * Records everything logged through one logback logger while it is attached.
 * <p>
 * Attach in a set-up method and call {@link #stop()} (or close) when done.
 */
public class LoggingTestSupport implements AutoCloseable {
    private final Logger logger;
    private final ListAppender<ILoggingEvent> appender;

    public LoggingTestSupport(Class<?> classUnderTest) {
        this(logger(classUnderTest));
    }

    public LoggingTestSupport(String name) {
        this(logger(name));
    }

    private LoggingTestSupport(Logger logger) {
        this.logger = requireNonNull(logger);
        this.appender = new ListAppender<>();
        this.appender.setContext((Context) LoggerFactory.getILoggerFactory());
        this.appender.start();
        this.logger.addAppender(appender);
    }

    public void stop() {
        logger.detachAppender(appender);
        appender.stop();
    }

    @Override
    public void close() {
        stop();
    }

    public List<ILoggingEvent> log() {
        return appender.list;
    }

    public List<String> messages() {
        return log().stream()
                .map(ILoggingEvent::getFormattedMessage)
                .collect(toList());
    }

    public ILoggingEvent lastMessage() {
        List<ILoggingEvent> events = log();
        return events.isEmpty() ? null : events.get(events.size() - 1);
    }

    private static Logger logger(Class<?> classUnderTest) {
        return (Logger) getLogger(requireNonNull(classUnderTest));
    }

    private static Logger logger(String name) {
        return (Logger) getLogger(requireNonNull(name));
    }

    @Override
    public String toString() {
        return log().stream().map(Object::toString).collect(joining("\n"));
    }
}
