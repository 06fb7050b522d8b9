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
package com.rootio.serializer;

import com.rootio.binary.Binary;
import com.rootio.exception.ErrorCode;
import com.rootio.exception.RootIOException;
import com.rootio.exception.SerializationException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

import static com.rootio.serializer.StreamerElement.base;
import static com.rootio.serializer.StreamerElement.container;
import static com.rootio.serializer.StreamerElement.fixedArray;
import static com.rootio.serializer.StreamerElement.object;
import static com.rootio.serializer.StreamerElement.pointer;
import static com.rootio.serializer.StreamerElement.primitive;
import static com.rootio.serializer.StreamerElement.variableArray;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StreamerRegistryTest {
  private static final int DISPLACEMENT = 60;

  private static final StreamerInfo EVENT_V1 = StreamerInfo.of("Event", 1, primitive("id", FieldKind.INT32));
  private static final StreamerInfo EVENT_V2 = StreamerInfo.of("Event", 2, primitive("id", FieldKind.INT32),
      primitive("energy", FieldKind.FLOAT64));
  private static final StreamerInfo EVENT_V5 = StreamerInfo.of("Event", 5, primitive("id", FieldKind.INT32),
      primitive("energy", FieldKind.FLOAT64), primitive("tag", FieldKind.STRING));

  private static final StreamerInfo HOLDER = StreamerInfo.of("Holder", 1, container("events", "Event"),
      primitive("after", FieldKind.INT32));

  private static final StreamerInfo EVERYTHING = StreamerInfo.of("Everything", 3, //
      primitive("b", FieldKind.BOOL), //
      primitive("i8", FieldKind.INT8), //
      primitive("i16", FieldKind.INT16), //
      primitive("i32", FieldKind.INT32), //
      primitive("i64", FieldKind.INT64), //
      primitive("u8", FieldKind.UINT8), //
      primitive("u16", FieldKind.UINT16), //
      primitive("u32", FieldKind.UINT32), //
      primitive("u64", FieldKind.UINT64), //
      primitive("f32", FieldKind.FLOAT32), //
      primitive("f64", FieldKind.FLOAT64), //
      primitive("s", FieldKind.STRING), //
      fixedArray("fixed", FieldKind.INT16, 3), //
      primitive("n", FieldKind.UINT32), //
      variableArray("var", FieldKind.FLOAT64, "n"), //
      object("named", NamedBinding.CLASS_NAME), //
      pointer("ptr", "Event"), //
      pointer("nothing", "Event"), //
      container("names", StreamerElement.STRING_CLASS), //
      container("events", "Event"));

  @Test
  void everyFieldKindRoundTrips() {
    final StreamerRegistry registry = new StreamerRegistry();
    registry.register(EVENT_V2);
    registry.register(EVERYTHING);

    final GenericObject event = new GenericObject("Event").set("id", 7).set("energy", 1.5D);
    final GenericObject original = new GenericObject("Everything")//
        .set("b", true)//
        .set("i8", (byte) -8)//
        .set("i16", (short) -16)//
        .set("i32", -32)//
        .set("i64", -64L)//
        .set("u8", (short) 200)//
        .set("u16", 60000)//
        .set("u32", 4000000000L)//
        .set("u64", Long.MAX_VALUE)//
        .set("f32", 3.25F)//
        .set("f64", Math.PI)//
        .set("s", "hello")//
        .set("fixed", new short[] { 1, 2, 3 })//
        .set("n", 4L)//
        .set("var", new double[] { 0.5, 1.5, 2.5, 3.5 })//
        .set("named", new GenericObject(NamedBinding.CLASS_NAME).set("TObject", GenericCodec.newTObject()).set("fName", "n")
            .set("fTitle", "t"))//
        .set("ptr", event)//
        .set("nothing", null)//
        .set("names", List.of("a", "bb", ""))//
        .set("events", List.of(event, new GenericObject("Event").set("id", 8).set("energy", -1D)));

    final byte[] payload = registry.marshal(original);
    final Object decoded = registry.unmarshal("Everything", payload, null);

    assertThat(decoded).isInstanceOf(GenericObject.class).isEqualTo(original);
    assertThat(((GenericObject) decoded).getVersion()).isEqualTo((short) 3);
    assertThat(registry.marshal(decoded)).isEqualTo(payload);
  }

  @Test
  void bindingsProduceJavaObjects() {
    final StreamerRegistry registry = new StreamerRegistry();
    final Named named = new Named("histogram", "energy distribution");

    final byte[] payload = registry.marshal(named);

    assertThat(registry.getClassName(named)).isEqualTo(NamedBinding.CLASS_NAME);
    assertThat(registry.unmarshal(NamedBinding.CLASS_NAME, payload, null)).isEqualTo(named);
    assertThat(registry.getWrittenStreamerInfos()).extracting(StreamerInfo::getClassName)
        .containsExactly(NamedBinding.CLASS_NAME, StreamerElement.TOBJECT_CLASS);
  }

  @Test
  void namedObjectsKeepTheirObjectBase() {
    // TNamed v1: TObject v1 (no unique id, heap bits), then "n" and "t"
    final byte[] stored = { 0x40, 0, 0, 0x10, 0, 1, 0, 1, 0, 0, 0, 0, 3, 0, 0, 0, 1, 'n', 1, 't' };
    final StreamerRegistry registry = new StreamerRegistry();

    assertThat(registry.unmarshal(NamedBinding.CLASS_NAME, stored, null)).isEqualTo(new Named("n", "t"));
    assertThat(registry.marshal(new Named("n", "t"))).isEqualTo(stored);
  }

  @Test
  void newerTopLevelObjectIsSkipped() {
    final StreamerRegistry writer = new StreamerRegistry();
    writer.register(EVENT_V2);
    final byte[] payload = writer.marshal(new GenericObject("Event").set("id", 1).set("energy", 2D));

    final StreamerRegistry reader = new StreamerRegistry();
    reader.register(EVENT_V1);

    final Object decoded = reader.unmarshal("Event", payload, null);
    assertThat(decoded).isInstanceOf(SkippedObject.class);
    assertThat(((SkippedObject) decoded).getVersion()).isEqualTo((short) 2);
    assertThat(((SkippedObject) decoded).getByteCount()).isEqualTo(payload.length - 4);
  }

  @Test
  void newerNestedObjectIsSkippedAndSiblingsStillDecode() {
    final StreamerRegistry writer = new StreamerRegistry();
    writer.register(EVENT_V2);
    writer.register(HOLDER);
    final byte[] payload = writer.marshal(new GenericObject("Holder")//
        .set("events", List.of(new GenericObject("Event").set("id", 1).set("energy", 2D)))//
        .set("after", 12345));

    final StreamerRegistry reader = new StreamerRegistry();
    reader.register(EVENT_V1);
    reader.register(HOLDER);

    final GenericObject holder = (GenericObject) reader.unmarshal("Holder", payload, null);
    assertThat(holder.getInt("after")).isEqualTo(12345);
    final List<Object> events = holder.get("events");
    assertThat(events).hasSize(1);
    assertThat(events.get(0)).isInstanceOf(SkippedObject.class);
  }

  @Test
  void missingVersionDecodesWithClosestOlderLayout() {
    final StreamerInfo eventV3 = StreamerInfo.of("Event", 3, primitive("id", FieldKind.INT32), primitive("energy", FieldKind.FLOAT64),
        primitive("extra", FieldKind.INT64));
    final StreamerRegistry writer = new StreamerRegistry();
    writer.register(eventV3);
    writer.register(HOLDER);
    final byte[] payload = writer.marshal(new GenericObject("Holder")//
        .set("events", List.of(new GenericObject("Event").set("id", 9).set("energy", 4D).set("extra", 1L)))//
        .set("after", 77));

    final StreamerRegistry reader = new StreamerRegistry();
    reader.register(EVENT_V2);
    reader.register(EVENT_V5);
    reader.register(HOLDER);

    final GenericObject holder = (GenericObject) reader.unmarshal("Holder", payload, null);
    final GenericObject event = (GenericObject) holder.<List<Object>>get("events").get(0);
    assertThat(event.getVersion()).isEqualTo((short) 3);
    assertThat(event.getInt("id")).isEqualTo(9);
    assertThat(event.<Double>get("energy")).isEqualTo(4D);
    assertThat(event.has("extra")).isFalse();
    assertThat(holder.getInt("after")).isEqualTo(77);
  }

  @Test
  void unknownClass() {
    final StreamerRegistry registry = new StreamerRegistry();
    registry.register(EVENT_V1);
    final byte[] payload = registry.marshal(new GenericObject("Event").set("id", 1));

    assertThatThrownBy(() -> registry.unmarshal("Missing", payload, null)).isInstanceOf(SerializationException.class)
        .satisfies(e -> assertThat(((SerializationException) e).getErrorCode()).isEqualTo(ErrorCode.UNKNOWN_CLASS));
    assertThatThrownBy(() -> registry.marshal(new GenericObject("Missing"))).isInstanceOf(SerializationException.class)
        .satisfies(e -> assertThat(((SerializationException) e).getErrorCode()).isEqualTo(ErrorCode.UNKNOWN_CLASS));
    assertThatThrownBy(() -> registry.marshal("not bound")).isInstanceOf(SerializationException.class);
  }

  @Test
  void versionOlderThanEveryLayout() {
    final StreamerRegistry writer = new StreamerRegistry();
    writer.register(EVENT_V2);
    final byte[] payload = writer.marshal(new GenericObject("Event").set("id", 1).set("energy", 2D));

    final StreamerRegistry reader = new StreamerRegistry();
    reader.register(EVENT_V5);

    assertThatThrownBy(() -> reader.unmarshal("Event", payload, null)).isInstanceOf(SerializationException.class)
        .satisfies(e -> assertThat(((SerializationException) e).getErrorCode()).isEqualTo(ErrorCode.UNKNOWN_VERSION));
  }

  @Test
  void newerVersionWithoutByteCountCannotBeSkipped() {
    final Binary buffer = new Binary();
    buffer.putShort((short) 9);
    buffer.putInt(1);

    final StreamerRegistry reader = new StreamerRegistry();
    reader.register(EVENT_V1);

    assertThatThrownBy(() -> reader.unmarshal("Event", buffer.toByteArray(), null)).isInstanceOf(SerializationException.class)
        .satisfies(e -> assertThat(((SerializationException) e).getErrorCode()).isEqualTo(ErrorCode.UNKNOWN_VERSION));
  }

  @Test
  void legacyObjectWithoutByteCount() {
    final Binary buffer = new Binary();
    buffer.putShort((short) 1);
    buffer.putInt(31);

    final StreamerRegistry reader = new StreamerRegistry();
    reader.register(EVENT_V1);

    final GenericObject event = (GenericObject) reader.unmarshal("Event", buffer.toByteArray(), null);
    assertThat(event.getInt("id")).isEqualTo(31);
  }

  @Test
  void byteCountMismatchAtExactVersion() {
    final StreamerRegistry registry = new StreamerRegistry();
    registry.register(EVENT_V1);
    final byte[] payload = registry.marshal(new GenericObject("Event").set("id", 1));

    final Binary patched = new Binary();
    patched.putByteArray(payload);
    patched.putShort((short) 0);
    patched.putInt(0, (payload.length - 4 + 2) | 0x40000000);

    assertThatThrownBy(() -> registry.unmarshal("Event", patched.toByteArray(), null)).isInstanceOf(SerializationException.class)
        .satisfies(e -> assertThat(((SerializationException) e).getErrorCode()).isEqualTo(ErrorCode.SERIALIZATION_ERROR));
  }

  @Test
  void invalidFieldValues() {
    final StreamerRegistry registry = new StreamerRegistry();
    registry.register(EVENT_V1);

    assertThatThrownBy(() -> registry.marshal(new GenericObject("Event"))).isInstanceOf(SerializationException.class)
        .hasMessageContaining("Missing value for field 'id'");
    assertThatThrownBy(() -> registry.marshal(new GenericObject("Event").set("id", "seven"))).isInstanceOf(
        SerializationException.class);

    final StreamerRegistry other = new StreamerRegistry();
    other.register(StreamerInfo.of("Var", 1, primitive("n", FieldKind.INT32), variableArray("v", FieldKind.INT32, "n")));
    assertThatThrownBy(() -> other.marshal(new GenericObject("Var").set("n", 3).set("v", new int[] { 1, 2 }))).isInstanceOf(
        SerializationException.class).hasMessageContaining("expected 3");
  }

  @Test
  void countFieldMustPrecedeTheArray() {
    assertThatThrownBy(() -> StreamerInfo.of("Bad", 1, variableArray("v", FieldKind.INT32, "n"), primitive("n", FieldKind.INT32)))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> StreamerInfo.of("Bad", 1, primitive("n", FieldKind.FLOAT32), variableArray("v", FieldKind.INT32, "n")))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void layoutIsLockedOnceWritten() {
    final StreamerRegistry registry = new StreamerRegistry();
    registry.register(EVENT_V1);
    assertThat(registry.isLocked("Event")).isFalse();

    // BEFORE THE FIRST WRITE A LAYOUT CAN BE REPLACED
    registry.register(EVENT_V2);
    registry.marshal(new GenericObject("Event").set("id", 1).set("energy", 1D));
    assertThat(registry.isLocked("Event")).isTrue();

    // SAME LAYOUT AGAIN AND OLDER LAYOUTS ARE ACCEPTED
    registry.register(EVENT_V2);
    registry.register(StreamerInfo.of("Event", 0, primitive("old", FieldKind.INT16)));

    final StreamerInfo changed = StreamerInfo.of("Event", 2, primitive("id", FieldKind.INT64));
    assertThatThrownBy(() -> registry.register(changed)).isInstanceOf(SerializationException.class)
        .satisfies(e -> assertThat(((SerializationException) e).getErrorCode()).isEqualTo(ErrorCode.STREAMER_LAYOUT_LOCKED));
    assertThatThrownBy(() -> registry.register(EVENT_V5)).isInstanceOf(SerializationException.class);

    assertThat(registry.getLatest("Event")).isEqualTo(EVENT_V2);
  }

  @Test
  void streamerInfoListRoundTrips() {
    final List<StreamerInfo> infos = List.of(EVENT_V2, HOLDER, EVERYTHING);

    final List<StreamerInfo> decoded = StreamerInfoCodec.decode(StreamerInfoCodec.encode(infos));

    assertThat(decoded).containsExactlyElementsOf(infos);
    assertThat(decoded.get(2).getChecksum()).isEqualTo(EVERYTHING.getChecksum());
    assertThat(decoded.get(2).getDependencies()).containsExactly(NamedBinding.CLASS_NAME, "Event");
  }

  @Test
  void storedStreamerInfoListIsDecoded() {
    final Map<String, Integer> classes = new HashMap<>();
    final Binary buffer = new Binary();
    buffer.setDisplacement(DISPLACEMENT);

    final int list = beginObject(buffer, 5);
    writeTObject(buffer);
    buffer.putString("");
    buffer.putInt(3);

    final int[] event = beginInfo(buffer, classes, "Event", 3, 0x1234ABCD, 6);
    element(buffer, classes, "TStreamerBase", 3, "TObject", "", 66, 0, "BASE", b -> b.putInt(1));
    element(buffer, classes, "TStreamerBasicType", 2, "fId", "", 3, 0, "Int_t", null);
    element(buffer, classes, "TStreamerBasicType", 2, "fPos", "", 25, 3, "Float_t", null);
    element(buffer, classes, "TStreamerString", 2, "fName", "", 65, 0, "TString", null);
    element(buffer, classes, "TStreamerBasicPointer", 2, "fData", "[fId]", 48, 0, "Double_t*", b -> {
      b.putInt(3);
      b.putString("fId");
      b.putString("Event");
    });
    element(buffer, classes, "TStreamerSTL", 3, "fTags", "", 500, 0, "vector<string>", b -> {
      b.putInt(1);
      b.putInt(365);
    });
    endInfo(buffer, event);
    buffer.putUnsignedByte(0);

    // COMPRESSED DOUBLES HAVE NO KIND: THE WHOLE LAYOUT IS IGNORED
    final int[] hit = beginInfo(buffer, classes, "Hit", 1, 7, 2);
    element(buffer, classes, "TStreamerBasicType", 2, "fE", "[0,10,16]", 9, 0, "Double32_t", null);
    element(buffer, classes, "TStreamerBasicType", 2, "fT", "", 5, 0, "Float_t", null);
    endInfo(buffer, hit);
    buffer.putUnsignedByte(0);

    final int rules = beginTagged(buffer, classes, "TList");
    final int rulesList = beginObject(buffer, 5);
    writeTObject(buffer);
    buffer.putString("listOfRules");
    buffer.putInt(0);
    endCount(buffer, rulesList);
    endCount(buffer, rules);
    buffer.putUnsignedByte(3);
    buffer.putByteArray("opt".getBytes(StandardCharsets.US_ASCII));

    endCount(buffer, list);

    final List<StreamerInfo> decoded = StreamerInfoCodec.decode(buffer.toByteArray(), DISPLACEMENT);

    final StreamerInfo expected = StreamerInfo.of("Event", 3, base(StreamerElement.TOBJECT_CLASS, 1), primitive("fId", FieldKind.INT32),
        fixedArray("fPos", FieldKind.FLOAT32, 3), primitive("fName", FieldKind.STRING), variableArray("fData", FieldKind.FLOAT64, "fId"),
        container("fTags", StreamerElement.STRING_CLASS));
    assertThat(decoded).containsExactly(expected);
    assertThat(decoded.get(0).getChecksum()).isEqualTo(0x1234ABCD);

    // WRITTEN BACK, THE STORED CHECKSUM IS KEPT
    final List<StreamerInfo> again = StreamerInfoCodec.decode(StreamerInfoCodec.encode(decoded, DISPLACEMENT), DISPLACEMENT);
    assertThat(again).containsExactly(expected);
    assertThat(again.get(0).getChecksum()).isEqualTo(0x1234ABCD);
  }

  @Test
  void streamerInfoListWithUnknownClassReference() {
    final Binary buffer = new Binary();
    final int list = beginObject(buffer, 5);
    writeTObject(buffer);
    buffer.putString("");
    buffer.putInt(1);
    final int tagged = beginCount(buffer);
    buffer.putInt(0x80000000 | 1234);
    endCount(buffer, tagged);
    buffer.putUnsignedByte(0);
    endCount(buffer, list);

    assertThatThrownBy(() -> StreamerInfoCodec.decode(buffer.toByteArray())).isInstanceOf(SerializationException.class)
        .hasMessageContaining("unknown class tag");
  }

  @Test
  void truncatedStreamerInfoList() {
    final byte[] encoded = StreamerInfoCodec.encode(List.of(EVENT_V2, HOLDER));
    final byte[] truncated = Arrays.copyOf(encoded, encoded.length / 2);

    assertThatThrownBy(() -> StreamerInfoCodec.decode(truncated)).isInstanceOf(RootIOException.class);
  }

  @Test
  void fileLayoutsOverrideBuiltInOnes() {
    final StreamerRegistry registry = new StreamerRegistry();
    final StreamerInfo stored = StreamerInfo.of(NamedBinding.CLASS_NAME, 1, primitive("fName", FieldKind.STRING),
        primitive("fTitle", FieldKind.STRING), primitive("fBits", FieldKind.UINT32));

    registry.loadFileStreamerInfos(List.of(stored));

    assertThat(registry.getStreamerInfo(NamedBinding.CLASS_NAME, 1)).isSameAs(stored);
    assertThat(registry.getFileStreamerInfos()).containsExactly(stored);
    assertThat(registry.getClassNames()).contains(NamedBinding.CLASS_NAME, "TTree");
  }

  private static int beginCount(final Binary buffer) {
    final int position = buffer.position();
    buffer.putInt(0);
    return position;
  }

  private static void endCount(final Binary buffer, final int position) {
    buffer.putInt(position, (buffer.position() - position - 4) | 0x40000000);
  }

  private static int beginObject(final Binary buffer, final int version) {
    final int position = beginCount(buffer);
    buffer.putShort((short) version);
    return position;
  }

  private static void writeTObject(final Binary buffer) {
    buffer.putShort((short) 1);
    buffer.putInt(0);
    buffer.putInt(0x03000000);
  }

  private static void writeNamed(final Binary buffer, final String name, final String title) {
    final int named = beginObject(buffer, 1);
    writeTObject(buffer);
    buffer.putString(name);
    buffer.putString(title);
    endCount(buffer, named);
  }

  /**
   * Writes the byte count and the class tag: the class name the first time, a reference to that first tag afterwards.
   */
  private static int beginTagged(final Binary buffer, final Map<String, Integer> classes, final String className) {
    final int position = beginCount(buffer);
    final Integer reference = classes.get(className);
    if (reference != null)
      buffer.putInt(0x80000000 | reference);
    else {
      classes.put(className, buffer.position() + DISPLACEMENT + 2);
      buffer.putInt(0xFFFFFFFF);
      buffer.putCString(className);
    }
    return position;
  }

  /**
   * @return the positions of the info and element array byte counts, closed by {@link #endInfo(Binary, int[])}
   */
  private static int[] beginInfo(final Binary buffer, final Map<String, Integer> classes, final String className, final int version,
      final int checksum, final int elements) {
    final int tag = beginTagged(buffer, classes, "TStreamerInfo");
    final int info = beginObject(buffer, 9);
    writeNamed(buffer, className, "");
    buffer.putInt(checksum);
    buffer.putInt(version);
    final int arrayTag = beginTagged(buffer, classes, "TObjArray");
    final int array = beginObject(buffer, 3);
    writeTObject(buffer);
    buffer.putString("");
    buffer.putInt(elements);
    buffer.putInt(0);
    return new int[] { tag, info, arrayTag, array };
  }

  private static void endInfo(final Binary buffer, final int[] positions) {
    for (int i = positions.length - 1; i >= 0; i--)
      endCount(buffer, positions[i]);
  }

  private static void element(final Binary buffer, final Map<String, Integer> classes, final String elementClass, final int version,
      final String name, final String title, final int type, final int arrayLength, final String typeName,
      final Consumer<Binary> extra) {
    final int tag = beginTagged(buffer, classes, elementClass);
    final int outer = beginObject(buffer, version);
    final int inner = beginObject(buffer, 4);
    writeNamed(buffer, name, title);
    buffer.putInt(type);
    buffer.putInt(0);
    buffer.putInt(arrayLength);
    buffer.putInt(arrayLength > 0 ? 1 : 0);
    for (int i = 0; i < 5; i++)
      buffer.putInt(i == 0 ? arrayLength : 0);
    buffer.putString(typeName);
    endCount(buffer, inner);
    if (extra != null)
      extra.accept(buffer);
    endCount(buffer, outer);
    endCount(buffer, tag);
  }
}
