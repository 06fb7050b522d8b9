/*
 * Copyright © 2021-present Arcade Data Ltd (info@arcadedata.com)
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
 * SPDX-FileCopyrightText: 2021-present Arcade Data Ltd (info@arcadedata.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.rootio.engine;

import com.rootio.ContextConfiguration;
import com.rootio.GlobalConfiguration;
import com.rootio.compression.CompressionAlgorithm;
import com.rootio.exception.ClosedHandleException;
import com.rootio.exception.CorruptionException;
import com.rootio.exception.ErrorCode;
import com.rootio.exception.InvalidDirectoryException;
import com.rootio.exception.NotFoundException;
import com.rootio.exception.OperationCancelledException;
import com.rootio.exception.RootIOException;
import com.rootio.exception.SerializationException;
import com.rootio.exception.StorageException;
import com.rootio.serializer.FieldKind;
import com.rootio.serializer.GenericObject;
import com.rootio.serializer.Named;
import com.rootio.serializer.NamedBinding;
import com.rootio.serializer.ObjectBinding;
import com.rootio.serializer.StreamerElement;
import com.rootio.serializer.StreamerInfo;
import com.rootio.serializer.StreamerRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RootFileTest {
  @TempDir
  Path   tempDir;
  String path;

  @BeforeEach
  void setUp() {
    path = tempDir.resolve("test.root").toString();
  }

  @Test
  void writeAndReadNamedObjects() {
    try (final RootFile file = RootFile.create(path, "test file", new ContextConfiguration())) {
      file.put("h1", "first histogram", new Named("h1", "energy"));
      file.put("h2", new Named("h2", "momentum"));
    }

    try (final RootFile file = RootFile.open(path)) {
      assertThat(file.getName()).isEqualTo("test.root");
      assertThat(file.getTitle()).isEqualTo("test file");
      assertThat(file.getKeys()).extracting(Key::getName).containsExactly("h1", "h2");
      assertThat(file.getKeys().get(0).getTitle()).isEqualTo("first histogram");
      assertThat(file.getKeys().get(0).getClassName()).isEqualTo(NamedBinding.CLASS_NAME);

      assertThat(file.get("h1")).isEqualTo(new Named("h1", "energy"));
      assertThat(file.get("/h2", Named.class).getTitle()).isEqualTo("momentum");
    }
  }

  @Test
  void putSameNameCreatesNewCycle() {
    try (final RootFile file = RootFile.create(path)) {
      assertThat(file.put("obj", new Named("a", "v1")).getCycle()).isEqualTo((short) 1);
      assertThat(file.put("obj", new Named("a", "v2")).getCycle()).isEqualTo((short) 2);
    }

    try (final RootFile file = RootFile.open(path)) {
      assertThat(file.getKeys()).hasSize(2);
      assertThat(file.get("obj", Named.class).getTitle()).isEqualTo("v2");
      assertThat(file.get("obj;1", Named.class).getTitle()).isEqualTo("v1");
      assertThat(file.get("obj;2", Named.class).getTitle()).isEqualTo("v2");
      assertThat(file.getDirectory().getKey("obj").getCycle()).isEqualTo((short) 2);

      assertThatThrownBy(() -> file.get("obj;3")).isInstanceOf(NotFoundException.class);
      assertThatThrownBy(() -> file.get("obj;x")).isInstanceOf(NotFoundException.class);
    }
  }

  @Test
  void nestedDirectories() {
    try (final RootFile file = RootFile.create(path)) {
      final Directory c = file.mkdir("a/b/c");
      assertThat(c.getPath()).isEqualTo("/a/b/c");
      c.put("deep", new Named("deep", "object"));

      final Directory a = file.getDirectory().getDirectory("a");
      a.put("shallow", new Named("shallow", ""));
      a.mkdir("d");

      // READ BACK BEFORE CLOSING
      assertThat(file.get("a/b/c/deep", Named.class).getName()).isEqualTo("deep");
    }

    try (final RootFile file = RootFile.open(path)) {
      assertThat(file.getKeys()).extracting(Key::getName).containsExactly("a");
      assertThat(file.get("a/b/c/deep", Named.class).getTitle()).isEqualTo("object");
      assertThat(file.get("/a/shallow", Named.class).getName()).isEqualTo("shallow");

      final Directory a = file.get("a", Directory.class);
      assertThat(a.getDirectories()).extracting(Directory::getName).containsExactly("b", "d");
      assertThat(a.get("b/c/deep", Named.class).getName()).isEqualTo("deep");
      assertThat(a.getDirectory("b").get("/a/shallow", Named.class).getName()).isEqualTo("shallow");
      assertThat(a.getDirectory("d").getKeys()).isEmpty();
      assertThat(a.getParent()).isSameAs(file.getDirectory());
    }
  }

  @Test
  void walkVisitsDepthFirstInInsertionOrder() {
    try (final RootFile file = RootFile.create(path)) {
      file.put("first", new Named("1", ""));
      file.mkdir("dir").put("inner", new Named("2", ""));
      file.mkdir("dir/sub");
      file.put("last", new Named("3", ""));
    }

    try (final RootFile file = RootFile.open(path)) {
      final List<String> visited = new ArrayList<>();
      file.walk((p, object) -> visited.add(p + (object instanceof Directory ? "/" : "")));

      assertThat(visited).containsExactly("//", "/first", "/dir/", "/dir/inner", "/dir/sub/", "/last");
    }
  }

  @Test
  void walkCanBeCancelled() {
    try (final RootFile file = RootFile.create(path)) {
      for (int i = 0; i < 10; i++)
        file.put("obj" + i, new Named("n" + i, ""));

      final AtomicInteger visited = new AtomicInteger();
      assertThatThrownBy(() -> file.walk((p, object) -> visited.incrementAndGet(), () -> visited.get() >= 4)).isInstanceOf(
          OperationCancelledException.class);
      assertThat(visited.get()).isEqualTo(4);
    }
  }

  @Test
  void invalidDirectoryOperations() {
    try (final RootFile file = RootFile.create(path)) {
      final Directory dir = file.mkdir("dir");
      file.put("obj", new Named("obj", ""));

      assertInvalidDirectory(() -> file.mkdir("dir"));
      assertInvalidDirectory(() -> file.mkdir("obj"));
      assertInvalidDirectory(() -> file.mkdir("obj/sub"));
      assertInvalidDirectory(() -> file.put("dir", new Named("x", "")));
      assertInvalidDirectory(() -> dir.put("self", dir));
      assertInvalidDirectory(() -> dir.put("parent", file.getDirectory()));
      assertInvalidDirectory(() -> file.put("other", dir));
      assertInvalidDirectory(() -> file.getDirectory().getDirectory("obj"));

      assertThatThrownBy(() -> file.put("a/b", new Named("x", ""))).isInstanceOf(IllegalArgumentException.class);
      assertThatThrownBy(() -> file.put("a;1", new Named("x", ""))).isInstanceOf(IllegalArgumentException.class);
      assertThatThrownBy(() -> file.put("", new Named("x", ""))).isInstanceOf(IllegalArgumentException.class);
    }

    try (final RootFile file = RootFile.open(path)) {
      assertThat(file.isWritable()).isFalse();
      assertInvalidDirectory(() -> file.put("new", new Named("x", "")));
      assertInvalidDirectory(() -> file.mkdir("newdir"));
    }
  }

  @Test
  void missingKeys() {
    try (final RootFile file = RootFile.create(path)) {
      file.mkdir("dir");

      assertThatThrownBy(() -> file.get("nothing")).isInstanceOf(NotFoundException.class)
          .satisfies(e -> assertThat(((NotFoundException) e).getErrorCode()).isEqualTo(ErrorCode.KEY_NOT_FOUND))
          .satisfies(e -> assertThat(((NotFoundException) e).getContext()).containsEntry("key", "nothing"));
      assertThatThrownBy(() -> file.get("dir/nothing")).isInstanceOf(NotFoundException.class);
      assertThatThrownBy(() -> file.get("nodir/nothing")).isInstanceOf(NotFoundException.class);
      assertThat(file.getDirectory().exists("dir")).isTrue();
      assertThat(file.getDirectory().exists("nothing")).isFalse();
    }
  }

  @Test
  void typeMismatchOnTypedGet() {
    try (final RootFile file = RootFile.create(path)) {
      file.put("obj", new Named("obj", ""));

      assertThatThrownBy(() -> file.get("obj", Directory.class)).isInstanceOf(SerializationException.class)
          .hasMessageContaining("not a");
    }
  }

  @Test
  void closedHandle() {
    final RootFile file = RootFile.create(path);
    final Directory top = file.getDirectory();
    file.close();
    // SECOND CLOSE IS A NO-OP
    file.close();

    assertThat(file.isOpen()).isFalse();
    assertThatThrownBy(() -> file.get("x")).isInstanceOf(ClosedHandleException.class)
        .satisfies(e -> assertThat(((ClosedHandleException) e).getErrorCode()).isEqualTo(ErrorCode.CLOSED_HANDLE));
    assertThatThrownBy(() -> top.getKeys()).isInstanceOf(ClosedHandleException.class);
    assertThatThrownBy(() -> file.put("x", new Named("x", ""))).isInstanceOf(ClosedHandleException.class);
  }

  @Test
  void notARootFile() throws IOException {
    Files.write(tempDir.resolve("garbage.root"), "this is not the file you are looking for, move along".repeat(10).getBytes());
    Files.write(tempDir.resolve("short.root"), new byte[] { 'r', 'o' });

    assertThatThrownBy(() -> RootFile.open(tempDir.resolve("garbage.root").toString())).isInstanceOf(CorruptionException.class)
        .satisfies(e -> assertThat(((CorruptionException) e).getErrorCode()).isEqualTo(ErrorCode.NOT_A_ROOT_FILE));
    assertThatThrownBy(() -> RootFile.open(tempDir.resolve("short.root").toString())).isInstanceOf(CorruptionException.class)
        .satisfies(e -> assertThat(((CorruptionException) e).getErrorCode()).isEqualTo(ErrorCode.NOT_A_ROOT_FILE));
  }

  @Test
  void missingFile() {
    assertThatThrownBy(() -> RootFile.open(tempDir.resolve("missing.root").toString())).isInstanceOf(StorageException.class)
        .satisfies(e -> assertThat(((StorageException) e).getErrorCode()).isEqualTo(ErrorCode.IO_ERROR));
  }

  @Test
  void readPastTheEnd() {
    try (final RootFile file = RootFile.create(path)) {
      file.put("obj", new Named("obj", ""));
    }

    try (final RootFile file = RootFile.open(path)) {
      assertThatThrownBy(() -> file.read(file.getEnd() + 1000, 10)).isInstanceOf(StorageException.class)
          .satisfies(e -> assertThat(((StorageException) e).getErrorCode()).isEqualTo(ErrorCode.IO_ERROR))
          .satisfies(e -> assertThat(((StorageException) e).getContext()).containsKeys("path", "position"));
    }
  }

  @Test
  void unreadableStreamerInfosFallBackToBuiltInLayouts() throws IOException {
    final ContextConfiguration configuration = new ContextConfiguration();
    configuration.setValue(GlobalConfiguration.COMPRESSION_ALGORITHM, "none");
    try (final RootFile file = RootFile.create(path, configuration)) {
      file.put("h1", new Named("h1", "energy"));
    }

    // THE NUMBER OF LAYOUTS FOLLOWS THE LIST HEADER, ITS OBJECT BASE AND ITS EMPTY NAME
    final byte[] content = Files.readAllBytes(Path.of(path));
    final FileHeader header = FileHeader.read(content);
    final int keyLength = ByteBuffer.wrap(content).getShort((int) header.seekInfo + 14);
    ByteBuffer.wrap(content).putInt((int) header.seekInfo + keyLength + 17, Integer.MAX_VALUE);
    Files.write(Path.of(path), content);

    try (final RootFile file = RootFile.open(path)) {
      assertThat(file.getStreamerInfos()).isEmpty();
      assertThat(file.get("h1")).isEqualTo(new Named("h1", "energy"));
    }
  }

  @Test
  void separateHandlesReadConcurrently() throws Exception {
    try (final RootFile file = RootFile.create(path)) {
      final Directory sub = file.mkdir("sub");
      for (int i = 0; i < 20; i++)
        sub.put("h" + i, new Named("h" + i, "title " + i));
    }

    final ExecutorService executor = Executors.newFixedThreadPool(2);
    try {
      final List<Future<Integer>> results = new ArrayList<>();
      for (int t = 0; t < 2; t++)
        results.add(executor.submit(() -> {
          int found = 0;
          try (final RootFile file = RootFile.open(path)) {
            for (int i = 0; i < 20; i++)
              if (file.get("sub/h" + i, Named.class).getTitle().equals("title " + i))
                found++;
          }
          return found;
        }));

      for (final Future<Integer> result : results)
        assertThat(result.get(10, TimeUnit.SECONDS)).isEqualTo(20);
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  void fileMetadata() throws IOException {
    final ContextConfiguration configuration = new ContextConfiguration();
    configuration.setValue(GlobalConfiguration.COMPRESSION_ALGORITHM, "zstd");
    configuration.setValue(GlobalConfiguration.COMPRESSION_LEVEL, 3);

    final long end;
    final UUID uuid;
    try (final RootFile file = RootFile.create(path, configuration)) {
      file.put("obj", new Named("obj", "x".repeat(1000)));
      uuid = file.getUUID();
      assertThat(file.getStreamerInfos()).extracting(StreamerInfo::getClassName)
          .containsExactly(NamedBinding.CLASS_NAME, StreamerElement.TOBJECT_CLASS);
    }

    try (final RootFile file = RootFile.open(path)) {
      end = file.getEnd();
      assertThat(file.getVersion()).isGreaterThan(FileHeader.LARGE_FILE_VERSION);
      assertThat(file.getUUID()).isEqualTo(uuid);
      assertThat(file.getCompression().getAlgorithm()).isEqualTo(CompressionAlgorithm.ZSTD);
      assertThat(file.getCompression().getLevel()).isEqualTo(3);
      assertThat(file.getCreationTime()).isNotNull();
      assertThat(file.getModificationTime()).isAfterOrEqualTo(file.getCreationTime());

      // STREAMER INFOS AND FREE SEGMENTS ARE NOT LISTED AS KEYS
      assertThat(file.getKeys()).extracting(Key::getName).containsExactly("obj");
      assertThat(file.getStreamerInfos()).extracting(StreamerInfo::getClassName)
          .containsExactly(NamedBinding.CLASS_NAME, StreamerElement.TOBJECT_CLASS);

      assertThat(file.getFreeSegments()).hasSize(1);
      assertThat(file.getFreeSegments().get(0).getFirst()).isEqualTo(end);
      assertThat(file.getFreeSegments().get(0).getLast()).isGreaterThanOrEqualTo(RootFile.FREE_SEGMENT_LAST);

      final Key key = file.getKeys().get(0);
      assertThat(key.isCompressed()).isTrue();
      assertThat(key.getObjLen()).isGreaterThan(1000);
      assertThat(file.get("obj", Named.class).getTitle()).hasSize(1000);
    }

    assertThat(Files.size(Path.of(path))).isEqualTo(end);
  }

  @Test
  void fileLayoutStartsWithMagicAndTopKey() throws IOException {
    try (final RootFile file = RootFile.create(path)) {
      file.put("obj", new Named("obj", ""));
    }

    final byte[] content = Files.readAllBytes(Path.of(path));
    assertThat(new String(content, 0, 4)).isEqualTo("root");

    try (final RootFile file = RootFile.open(path)) {
      final Key top = file.readKey(FileHeader.BEGIN, null);
      assertThat(top.getClassName()).isEqualTo(Directory.FILE_CLASS_NAME);
      assertThat(top.getName()).isEqualTo("test.root");
      assertThat(file.getDirectory().getSeekDir()).isEqualTo(FileHeader.BEGIN);

      final Key info = file.readKey(file.getDirectory().getSeekKeys(), file.getDirectory());
      assertThat(info.getClassName()).isEqualTo(Directory.FILE_CLASS_NAME);
      assertThat(info.getName()).isEqualTo("test.root");
    }
  }

  @Test
  void genericObjectsWithRuntimeLayouts() {
    final StreamerInfo track = StreamerInfo.of("Track", 1, StreamerElement.primitive("px", FieldKind.FLOAT64),
        StreamerElement.primitive("py", FieldKind.FLOAT64), StreamerElement.primitive("charge", FieldKind.INT8));

    try (final RootFile file = RootFile.create(path)) {
      file.getStreamerRegistry().register(track);
      file.put("track", new GenericObject("Track").set("px", 1.0).set("py", -2.0).set("charge", (byte) -1));
    }

    // THE READER FINDS THE LAYOUT IN THE FILE
    try (final RootFile file = RootFile.open(path)) {
      assertThat(file.getStreamerInfos()).contains(track);
      final GenericObject decoded = file.get("track", GenericObject.class);
      assertThat(decoded.getClassName()).isEqualTo("Track");
      assertThat(decoded.<Double>get("py")).isEqualTo(-2.0);
      assertThat(decoded.<Byte>get("charge")).isEqualTo((byte) -1);
    }
  }

  @Test
  void userBindingsRegisteredByDefault() {
    final ObjectBinding<Point> binding = new PointBinding();
    StreamerRegistry.registerDefault(binding);
    try {
      try (final RootFile file = RootFile.create(path)) {
        file.put("origin", new Point(0, 0));
        file.put("p", new Point(3.5, -1));
      }
      try (final RootFile file = RootFile.open(path)) {
        assertThat(file.get("p")).isEqualTo(new Point(3.5, -1));
        assertThat(file.get("origin", Point.class).x).isZero();
      }
    } finally {
      StreamerRegistry.unregisterDefault(PointBinding.CLASS_NAME);
    }

    // WITHOUT THE BINDING THE SAME DATA DECODES AS A GENERIC OBJECT
    try (final RootFile file = RootFile.open(path)) {
      final GenericObject p = file.get("p", GenericObject.class);
      assertThat(p.<Double>get("x")).isEqualTo(3.5);
    }
  }

  @Test
  void failedPutLeavesTheFileUsable() {
    try (final RootFile file = RootFile.create(path)) {
      file.getStreamerRegistry().register(StreamerInfo.of("Broken", 1, StreamerElement.primitive("v", FieldKind.INT32)));
      assertThatThrownBy(() -> file.put("broken", new GenericObject("Broken"))).isInstanceOf(RootIOException.class);
      file.put("good", new Named("good", ""));
    }

    try (final RootFile file = RootFile.open(path)) {
      assertThat(file.getKeys()).extracting(Key::getName).containsExactly("good");
    }
  }

  private static void assertInvalidDirectory(final Runnable action) {
    assertThatThrownBy(action::run).isInstanceOf(InvalidDirectoryException.class)
        .satisfies(e -> assertThat(((InvalidDirectoryException) e).getErrorCode()).isEqualTo(ErrorCode.INVALID_DIRECTORY));
  }

  static class Point {
    final double x;
    final double y;

    Point(final double x, final double y) {
      this.x = x;
      this.y = y;
    }

    @Override
    public boolean equals(final Object o) {
      return o instanceof Point && ((Point) o).x == x && ((Point) o).y == y;
    }

    @Override
    public int hashCode() {
      return Double.hashCode(x) * 31 + Double.hashCode(y);
    }
  }

  static class PointBinding implements ObjectBinding<Point> {
    static final String CLASS_NAME = "TPoint";

    @Override
    public String getClassName() {
      return CLASS_NAME;
    }

    @Override
    public Class<Point> getType() {
      return Point.class;
    }

    @Override
    public List<StreamerInfo> getStreamerInfos() {
      return List.of(StreamerInfo.of(CLASS_NAME, 1, StreamerElement.primitive("x", FieldKind.FLOAT64),
          StreamerElement.primitive("y", FieldKind.FLOAT64)));
    }

    @Override
    public GenericObject toGeneric(final Point value) {
      return new GenericObject(CLASS_NAME).set("x", value.x).set("y", value.y);
    }

    @Override
    public Point fromGeneric(final GenericObject object, final RootFile file) {
      return new Point(object.<Double>get("x"), object.<Double>get("y"));
    }
  }
}
