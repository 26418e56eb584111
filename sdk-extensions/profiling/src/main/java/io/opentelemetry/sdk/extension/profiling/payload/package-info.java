/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

/** 上传负载的压缩与组装。 */
@ParametersAreNonnullByDefault
package io.opentelemetry.sdk.extension.profiling.payload;

import javax.annotation.ParametersAreNonnullByDefault;
