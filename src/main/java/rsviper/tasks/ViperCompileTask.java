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

import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableSortedMap;

import rsviper.cfg.CfgNormalizer;
import rsviper.cfg.NormalizedCfg;
import rsviper.encoder.EncodedProcedure;
import rsviper.encoder.ProcedureContract;
import rsviper.encoder.ProcedureEncoder;
import rsviper.lang.SpecificationError;
import rsviper.mir.Body;
import rsviper.mir.FunctionSig;
import rsviper.mir.MirProgram;
import rsviper.spec.FunctionSpec;
import rsviper.spec.ResolvedSpec;
import rsviper.spec.SpecExpr;
import rsviper.spec.SpecificationResolver;

/**
 * Translates the functions of a program into Viper. Each function is
 * normalised, its specification resolved against the normalised graph, and
 * the two encoded together as a single procedure. Calls are encoded against
 * the contracts of their callees, so that functions can be translated (and
 * verified) independently of each other.
 *
 * @author The Rust2Viper Project Developers
 */
public class ViperCompileTask {
	private static final Logger logger = LoggerFactory.getLogger(ViperCompileTask.class);

	private final MirProgram program;
	private final Map<String, FunctionSpec> specs;
	private final Config config;
	private final SpecificationResolver resolver = new SpecificationResolver();
	private ImmutableSortedMap<String, ProcedureContract> contracts;

	public ViperCompileTask(MirProgram program, Map<String, FunctionSpec> specs, Config config) {
		this.program = program;
		this.specs = specs;
		this.config = config;
	}

	public MirProgram getProgram() {
		return program;
	}

	/**
	 * Get the specification given for a function, which is empty if none was
	 * given.
	 *
	 * @param function
	 * @return
	 */
	public FunctionSpec getSpec(String function) {
		FunctionSpec s = specs.get(function);
		return s == null ? FunctionSpec.EMPTY : s;
	}

	/**
	 * Get the contract of every function which can be called. A contract which
	 * cannot be resolved is replaced by the empty contract: the error is
	 * reported against the function itself when it is verified, and callers
	 * are still checked for what they do with permissions.
	 *
	 * @return
	 */
	public synchronized Map<String, ProcedureContract> getContracts() {
		if (contracts == null) {
			ImmutableSortedMap.Builder<String, ProcedureContract> b = ImmutableSortedMap.naturalOrder();
			for (Map.Entry<String, FunctionSig> e : program.getSignatures().entrySet()) {
				b.put(e.getKey(), contract(e.getValue()));
			}
			contracts = b.build();
		}
		return contracts;
	}

	private ProcedureContract contract(FunctionSig signature) {
		FunctionSpec spec = getSpec(signature.getName());
		// Loop invariants are private to the body
		FunctionSpec.Builder b = FunctionSpec.builder();
		for (SpecExpr e : spec.getRequires()) {
			b.requires(e);
		}
		for (SpecExpr e : spec.getEnsures()) {
			b.ensures(e);
		}
		try {
			return new ProcedureContract(signature, resolver.resolveContract(b.build(), signature));
		} catch (SpecificationError e) {
			logger.warn("ignoring contract of {}: {}", signature.getName(), e.getMessage());
			return ProcedureContract.unspecified(signature);
		}
	}

	/**
	 * Translate a single function.
	 *
	 * @param body
	 * @return
	 */
	public EncodedProcedure compile(Body body) {
		NormalizedCfg cfg = new CfgNormalizer(config.isCheckingOverflow()).normalize(body);
		ResolvedSpec spec = resolver.resolve(getSpec(body.getName()), cfg);
		EncodedProcedure p = new ProcedureEncoder(config.isCheckingOverflow(), getContracts()).encode(cfg, spec);
		logger.debug("compiled {}", p);
		return p;
	}

	/**
	 * Translate every function with a body, stopping at the first which
	 * cannot be translated.
	 *
	 * @return
	 */
	public SortedMap<String, EncodedProcedure> compileAll() {
		TreeMap<String, EncodedProcedure> r = new TreeMap<>();
		for (Body b : program.getBodies()) {
			r.put(b.getName(), compile(b));
		}
		return r;
	}
}
