// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.lightrace;

import java.util.logging.Logger;

/// Shared logger for the core library. Hosts configure it through `java.util.logging`.
public interface LightraceLogger {
  Logger LOGGER = Logger.getLogger(LightraceLogger.class.getPackageName());
}
