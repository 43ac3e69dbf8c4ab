/**
 * Copyright 2017-2018 LendingClub, Inc.
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
package org.lendingclub.surveyor.cli;

import java.time.Instant;

import org.lendingclub.surveyor.core.JsonUtil;

import com.fasterxml.jackson.databind.node.ObjectNode;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.IThrowableProxy;
import ch.qos.logback.classic.spi.ThrowableProxyUtil;
import ch.qos.logback.core.CoreConstants;
import ch.qos.logback.core.LayoutBase;
import ch.qos.logback.core.encoder.Encoder;
import ch.qos.logback.core.encoder.LayoutWrappingEncoder;

/**
 * One JSON object per log event, for <code>--log-format json</code>.
 */
public class JsonLogLayout extends LayoutBase<ILoggingEvent> {

	@Override
	public String doLayout(ILoggingEvent event) {
		ObjectNode n = JsonUtil.createObjectNode();
		n.put("timestamp", Instant.ofEpochMilli(event.getTimeStamp()).toString());
		n.put("level", event.getLevel().toString());
		n.put("logger", event.getLoggerName());
		n.put("thread", event.getThreadName());
		n.put("message", event.getFormattedMessage());
		IThrowableProxy t = event.getThrowableProxy();
		if (t != null) {
			n.put("exception", ThrowableProxyUtil.asString(t));
		}
		return n.toString() + CoreConstants.LINE_SEPARATOR;
	}

	static boolean isJson(Encoder<?> encoder) {
		return encoder instanceof LayoutWrappingEncoder
				&& ((LayoutWrappingEncoder<?>) encoder).getLayout() instanceof JsonLogLayout;
	}
}
