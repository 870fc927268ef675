/*
 * Copyright © 2025 ANEO (armonik@aneo.fr)
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
package org.mwasearch.worker.internal;

import org.mwasearch.pipeline.SearchPipelineException;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * File-system helpers shared by the command-line adapters.
 */
final class WorkDirectories {

  private WorkDirectories() {
  }

  static Path create(Path directory) {
    try {
      return Files.createDirectories(directory);
    } catch (IOException e) {
      throw new SearchPipelineException("Cannot create directory " + directory, e);
    }
  }

  /**
   * Lists the regular files of a directory matching a glob, sorted by name.
   */
  static List<Path> list(Path directory, String glob) {
    var files = new ArrayList<Path>();
    try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, glob)) {
      for (var file : stream) {
        if (Files.isRegularFile(file)) {
          files.add(file);
        }
      }
    } catch (IOException e) {
      throw new SearchPipelineException("Cannot list " + glob + " in " + directory, e);
    }
    files.sort(null);
    return files;
  }

  /**
   * Replaces the characters that cannot appear in a file name.
   */
  static String safeName(String name) {
    return name.replaceAll("[^A-Za-z0-9._+-]", "_");
  }
}
