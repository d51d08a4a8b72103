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

import org.hamcrest.Description;
import org.hamcrest.TypeSafeMatcher;

import java.util.regex.Pattern;

/**
 * Matches strings against a regular expression, in full.
 */
public final class RegExMatcher extends TypeSafeMatcher<String> {
    private final Pattern pattern;

    public RegExMatcher(String regex) {
        this.pattern = Pattern.compile(regex, Pattern.DOTALL);
    }

    public static RegExMatcher matchesRegex(String regex) {
        return new RegExMatcher(regex);
    }

    @Override
    protected boolean matchesSafely(String item) {
        return pattern.matcher(item).matches();
    }

    @Override
    public void describeTo(Description description) {
        description.appendText("a string matching /").appendText(pattern.pattern()).appendText("/");
    }

    @Override
    public String toString() {
        return pattern.pattern();
    }
}
