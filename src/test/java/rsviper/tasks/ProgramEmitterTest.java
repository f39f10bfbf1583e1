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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.Test;

import rsviper.Programs;
import rsviper.encoder.EncodedProcedure;
import rsviper.io.ViperFilePrinter;
import rsviper.mir.MirProgram;

public class ProgramEmitterTest {
	private final ProgramEmitter emitter = new ProgramEmitter();

	private static EncodedProcedure compile(MirProgram program, String function, Config config) {
		ViperCompileTask task = new ViperCompileTask(program, Collections.singletonMap("divide",
				Programs.divideSpec(true)), config);
		return task.compile(program.getBody(function));
	}

	@Test
	public void emittedProgramIsSelfContained() {
		MirProgram program = new MirProgram.Builder().add(Programs.divide()).build();
		String text = ViperFilePrinter.toString(emitter.emit(compile(program, "divide", Config.DEFAULT)));
		assertTrue(text.contains("field val_int: Int"), text);
		assertTrue(text.contains("function div$trunc(a: Int, b: Int): Int"), text);
		assertTrue(text.contains("function seq_sum("), text);
		assertTrue(text.contains(ProgramEmitter.TYPE_OF), text);
		assertTrue(text.contains("method m$divide()"), text);
		assertFalse(text.contains(ProgramEmitter.INT_BOUNDS), text);
	}

	@Test
	public void recursiveStructureGetsPredicateWithBody() {
		MirProgram program = new MirProgram.Builder().add(Programs.setHead(false)).build();
		String text = ViperFilePrinter.toString(emitter.emit(compile(program, "set_head", Config.DEFAULT)));
		assertTrue(text.contains("predicate adt$Node(self: Ref) { acc(self.f$Node$val, write) && "), text);
		assertTrue(text.contains("&& acc(adt$Node(self.f$Node$next.val_ref), write) }"), text);
		assertTrue(text.contains("field f$Node$next: Ref"), text);
	}

	@Test
	public void integerBoundsOnlyWithOverflowChecks() {
		MirProgram program = new MirProgram.Builder().add(Programs.divide()).build();
		String text = ViperFilePrinter.toString(
				emitter.emit(compile(program, "divide", Config.DEFAULT.withOverflowChecks(true))));
		assertTrue(text.contains(ProgramEmitter.INT_BOUNDS), text);
		assertTrue(text.contains("in$i32("), text);
	}

	@Test
	public void emissionIsIndependentOfOrder() {
		MirProgram program = new MirProgram.Builder().add(Programs.divide()).add(Programs.half(2)).build();
		EncodedProcedure divide = compile(program, "divide", Config.DEFAULT);
		EncodedProcedure half = compile(program, "half", Config.DEFAULT);
		String forwards = ViperFilePrinter.toString(emitter.emit(Arrays.asList(divide, half)));
		String backwards = ViperFilePrinter.toString(emitter.emit(Arrays.asList(half, divide)));
		assertEquals(forwards, backwards);
		assertTrue(forwards.indexOf("method m$divide()") < forwards.indexOf("method m$half()"), forwards);
	}

	@Test
	public void duplicateProcedureIsRejected() {
		MirProgram program = new MirProgram.Builder().add(Programs.divide()).build();
		EncodedProcedure divide = compile(program, "divide", Config.DEFAULT);
		assertThrows(IllegalArgumentException.class, () -> emitter.emit(Arrays.asList(divide, divide)));
	}
}
