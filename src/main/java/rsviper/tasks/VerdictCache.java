// Copyright 2024 The Rust2Viper Project Developers
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
package rsviper.tasks;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;

import rsviper.core.ViperFile;
import rsviper.encoder.EncodedProcedure;
import rsviper.encoder.Obligation;
import rsviper.io.ViperFilePrinter;

/**
 * Remembers the reports of programs which have already been checked. A
 * report is keyed on a hash of the exact program text, the obligations it
 * discharges and the settings that affect its verdicts. Any change to a
 * function (or to the contract of anything it calls) is therefore a miss, and
 * so is a change which only moves it within its file, since the report holds
 * the location of every obligation. Reports affected by a timeout are never
 * remembered, as a later run may well succeed.
 *
 * @author The Rust2Viper Project Developers
 */
public class VerdictCache {
	private static final Logger logger = LoggerFactory.getLogger(VerdictCache.class);

	private final ConcurrentHashMap<String, FunctionReport> reports = new ConcurrentHashMap<>();

	public static String key(EncodedProcedure procedure, ViperFile program, Config config) {
		Hasher h = Hashing.sha256().newHasher();
		h.putString(procedure.getName(), StandardCharsets.UTF_8);
		for (Obligation o : procedure.getObligations()) {
			h.putInt(o.getId());
			h.putString(o.getKind().name(), StandardCharsets.UTF_8);
			h.putString(o.getSpan().getFile(), StandardCharsets.UTF_8);
			h.putInt(o.getSpan().getLine());
			h.putInt(o.getSpan().getColumn());
			h.putString(o.getDescription(), StandardCharsets.UTF_8);
			h.putChar('\n');
		}
		h.putString(ViperFilePrinter.toString(program), StandardCharsets.UTF_8);
		h.putString(config.getFingerprint(), StandardCharsets.UTF_8);
		return h.hash().toString();
	}

	public FunctionReport get(String key) {
		FunctionReport r = reports.get(key);
		if (r != null) {
			logger.debug("cache hit for {}", r.getFunction());
		}
		return r;
	}

	public void put(String key, FunctionReport report) {
		if (report.isTimeout()) {
			return;
		}
		reports.put(key, report);
	}

	public int size() {
		return reports.size();
	}

	public void clear() {
		reports.clear();
	}
}
