/**
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
package org.kronos.scheduler.base;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * Utility class for turning job command strings into process arguments.
 */
public final class CommandUtil {

  private CommandUtil() {
    // Utility class.
  }

  /**
   * Splits a command line into arguments the way a POSIX shell would for simple commands:
   * whitespace separates arguments, single quotes preserve everything literally, double quotes
   * preserve whitespace and honour backslash escapes of {@code "} and {@code \}.
   *
   * @param command Command line to split.
   * @return The arguments, program first.
   * @throws IllegalArgumentException If a quote is left unterminated or the command is empty.
   */
  public static List<String> split(String command) {
    ImmutableList.Builder<String> args = ImmutableList.builder();
    StringBuilder current = new StringBuilder();
    boolean inArg = false;
    char quote = 0;

    for (int i = 0; i < command.length(); i++) {
      char c = command.charAt(i);
      if (quote == '\'') {
        if (c == '\'') {
          quote = 0;
        } else {
          current.append(c);
        }
      } else if (quote == '"') {
        if (c == '"') {
          quote = 0;
        } else if (c == '\\' && i + 1 < command.length()
            && (command.charAt(i + 1) == '"' || command.charAt(i + 1) == '\\')) {
          current.append(command.charAt(++i));
        } else {
          current.append(c);
        }
      } else if (Character.isWhitespace(c)) {
        if (inArg) {
          args.add(current.toString());
          current.setLength(0);
          inArg = false;
        }
      } else if (c == '\'' || c == '"') {
        quote = c;
        inArg = true;
      } else if (c == '\\' && i + 1 < command.length()) {
        current.append(command.charAt(++i));
        inArg = true;
      } else {
        current.append(c);
        inArg = true;
      }
    }

    if (quote != 0) {
      throw new IllegalArgumentException("Unterminated quote in command: " + command);
    }
    if (inArg) {
      args.add(current.toString());
    }

    List<String> result = args.build();
    if (result.isEmpty()) {
      throw new IllegalArgumentException("Command must not be empty.");
    }
    return result;
  }
}
