////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.astscope.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.OptionalInt;

/**
 * The top-level declarations parsed from one file. A file synthesized
 * without source text has no buffer.
 */
public class SourceFile {
	private final String name;
	private final Integer bufferId;
	private final List<Decl> decls;

	public SourceFile(String name, int bufferId, List<Decl> decls) {
		this(name, Integer.valueOf(bufferId), decls);
	}

	private SourceFile(String name, Integer bufferId, List<Decl> decls) {
		this.name = name;
		this.bufferId = bufferId;
		this.decls = decls != null ? new ArrayList<>(decls) : new ArrayList<>();
	}

	public static SourceFile withoutBuffer(String name, List<Decl> decls) {
		return new SourceFile(name, null, decls);
	}

	public String getName() {
		return name;
	}

	public OptionalInt getBufferId() {
		return bufferId != null ? OptionalInt.of(bufferId) : OptionalInt.empty();
	}

	public List<Decl> getDecls() {
		return Collections.unmodifiableList(decls);
	}
}
