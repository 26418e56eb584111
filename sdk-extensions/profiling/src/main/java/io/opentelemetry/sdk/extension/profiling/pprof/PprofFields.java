/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.profiling.pprof;

/** pprof profile.proto 字段编号 */
final class PprofFields {

  private PprofFields() {}

  enum Profile {
    SAMPLE_TYPE(1),
    SAMPLE(2),
    LOCATION(4),
    FUNCTION(5),
    STRING_TABLE(6),
    TIME_NANOS(9),
    DURATION_NANOS(10),
    PERIOD_TYPE(11),
    PERIOD(12),
    DEFAULT_SAMPLE_TYPE(14);

    final int index;

    Profile(int index) {
      this.index = index;
    }
  }

  enum ValueType {
    TYPE(1),
    UNIT(2);

    final int index;

    ValueType(int index) {
      this.index = index;
    }
  }

  enum Sample {
    LOCATION_ID(1),
    VALUE(2);

    final int index;

    Sample(int index) {
      this.index = index;
    }
  }

  enum Location {
    ID(1),
    LINE(4);

    final int index;

    Location(int index) {
      this.index = index;
    }
  }

  enum Line {
    FUNCTION_ID(1),
    LINE(2);

    final int index;

    Line(int index) {
      this.index = index;
    }
  }

  enum Function {
    ID(1),
    NAME(2),
    SYSTEM_NAME(3),
    FILENAME(4);

    final int index;

    Function(int index) {
      this.index = index;
    }
  }
}
