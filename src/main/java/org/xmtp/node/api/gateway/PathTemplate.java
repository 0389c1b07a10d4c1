/*
 * Copyright 2026 The gRPC Authors
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
 */

package org.xmtp.node.api.gateway;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * An HTTP path template in the {@code google.api.http} syntax, restricted to what the gateway
 * binds: literal segments, single-segment variables ({@code {name}} or {@code {name=*}}) and a
 * trailing multi-segment variable ({@code {name=**}}).
 */
final class PathTemplate {
  private static final Splitter SLASH = Splitter.on('/');

  private final String template;
  private final ImmutableList<Segment> segments;

  private PathTemplate(String template, ImmutableList<Segment> segments) {
    this.template = template;
    this.segments = segments;
  }

  /**
   * Parses {@code template}.
   *
   * @throws IllegalArgumentException if the template is malformed or uses unsupported syntax
   */
  static PathTemplate parse(String template) {
    checkArgument(template.startsWith("/"), "path template must start with '/': %s", template);
    ImmutableList.Builder<Segment> segments = ImmutableList.builder();
    List<String> parts = SLASH.splitToList(template.substring(1));
    for (int i = 0; i < parts.size(); i++) {
      String part = parts.get(i);
      checkArgument(!part.isEmpty(), "empty segment in path template: %s", template);
      if (!part.startsWith("{")) {
        checkArgument(part.indexOf('{') < 0 && part.indexOf('}') < 0,
            "malformed segment %s in %s", part, template);
        segments.add(Segment.literal(part));
        continue;
      }
      checkArgument(part.endsWith("}"), "malformed variable %s in %s", part, template);
      String body = part.substring(1, part.length() - 1);
      int eq = body.indexOf('=');
      String field = eq < 0 ? body : body.substring(0, eq);
      String pattern = eq < 0 ? "*" : body.substring(eq + 1);
      checkArgument(!field.isEmpty(), "variable without a name in %s", template);
      if (pattern.equals("*")) {
        segments.add(Segment.variable(field, false));
      } else if (pattern.equals("**")) {
        checkArgument(i == parts.size() - 1,
            "'**' is only supported in the last segment: %s", template);
        segments.add(Segment.variable(field, true));
      } else {
        throw new IllegalArgumentException(
            "unsupported variable pattern " + pattern + " in " + template);
      }
    }
    return new PathTemplate(template, segments.build());
  }

  /**
   * Matches a request path (without query string) against this template.
   *
   * @return the bound variables in template order, or {@code null} if the path does not match
   */
  @Nullable
  Map<String, String> match(String path) {
    if (!path.startsWith("/")) {
      return null;
    }
    List<String> parts = SLASH.splitToList(path.substring(1));
    Map<String, String> variables = new LinkedHashMap<>();
    for (int i = 0; i < segments.size(); i++) {
      Segment segment = segments.get(i);
      if (segment.multi) {
        if (i >= parts.size()) {
          return null;
        }
        variables.put(segment.value, Joiner.on('/').join(parts.subList(i, parts.size())));
        return variables;
      }
      if (i >= parts.size() || parts.get(i).isEmpty()) {
        return null;
      }
      if (segment.variable) {
        variables.put(segment.value, parts.get(i));
      } else if (!segment.value.equals(parts.get(i))) {
        return null;
      }
    }
    return parts.size() == segments.size() ? variables : null;
  }

  /** Names of the fields bound by this template's variables. */
  List<String> variableNames() {
    ImmutableList.Builder<String> names = ImmutableList.builder();
    for (Segment segment : segments) {
      if (segment.variable) {
        names.add(segment.value);
      }
    }
    return names.build();
  }

  @Override
  public String toString() {
    return template;
  }

  private static final class Segment {
    final String value;
    final boolean variable;
    final boolean multi;

    private Segment(String value, boolean variable, boolean multi) {
      this.value = value;
      this.variable = variable;
      this.multi = multi;
    }

    static Segment literal(String value) {
      return new Segment(value, false, false);
    }

    static Segment variable(String field, boolean multi) {
      return new Segment(field, true, multi);
    }
  }
}
