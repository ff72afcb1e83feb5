// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.lightrace.udp;

import java.util.logging.Logger;

public interface UdpLogger {
  Logger LOGGER = Logger.getLogger(UdpLogger.class.getPackageName());
}
