// Copyright 2024 The Bazel Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package net.autodep.syntax;

import java.util.Arrays;

/** FileLocations maps char offsets in a file to line and column numbers. */
final class FileLocations {

  private final String file;
  private final int[] linestart; // maps line number (line >= 1) to char offset
  private final int size; // size of file in chars

  private FileLocations(int[] linestart, String file, int size) {
    this.linestart = linestart;
    this.file = file;
    this.size = size;
  }

  static FileLocations create(char[] buffer, String file) {
    int[] linestart = new int[64];
    int nlines = 1;
    linestart[0] = 0; // line 0 (a fake line)
    linestart[1] = 0;
    for (int i = 0; i < buffer.length; i++) {
      if (buffer[i] == '\n') {
        if (nlines + 1 == linestart.length) {
          linestart = Arrays.copyOf(linestart, nlines << 1);
        }
        linestart[++nlines] = i + 1;
      }
    }
    return new FileLocations(Arrays.copyOf(linestart, nlines + 1), file, buffer.length);
  }

  String file() {
    return file;
  }

  private int getLineAt(int offset) {
    if (offset < 0 || offset > size) {
      throw new IllegalStateException("Illegal position: " + offset);
    }
    int index = Arrays.binarySearch(linestart, offset);
    if (index >= 0) {
      // Offset 0 is shared by the fake line 0 and line 1.
      while (index + 1 < linestart.length && linestart[index + 1] == offset) {
        index++;
      }
      return index;
    }
    return -index - 2;
  }

  /** Returns a syntax error located at the given char offset. */
  SyntaxError error(int offset, String message) {
    offset = Math.max(0, Math.min(offset, size));
    int line = getLineAt(offset);
    int column = offset - linestart[line] + 1;
    return new SyntaxError(file, line, column, message);
  }
}
