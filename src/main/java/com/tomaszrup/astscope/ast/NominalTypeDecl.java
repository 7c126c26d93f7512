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

import com.tomaszrup.astscope.source.SourceLoc;
import com.tomaszrup.astscope.source.SourceRange;

/**
 * A struct, class or enum declaration with a braced member list.
 */
public class NominalTypeDecl extends GenericContextDecl {
	public enum TypeKind {
		STRUCT, CLASS, ENUM, PROTOCOL
	}

	private final TypeKind typeKind;
	private final String name;
	private final SourceRange braces;
	private final List<Decl> members;

	public NominalTypeDecl(TypeKind typeKind, String name, SourceLoc keywordLoc, SourceRange braces,
			List<Decl> members) {
		super(keywordLoc, braces.getEnd());
		this.typeKind = typeKind;
		this.name = name;
		this.braces = braces;
		this.members = members != null ? new ArrayList<>(members) : new ArrayList<>();
	}

	public TypeKind getTypeKind() {
		return typeKind;
	}

	public String getName() {
		return name;
	}

	public SourceRange getBraces() {
		return braces;
	}

	public List<Decl> getMembers() {
		return Collections.unmodifiableList(members);
	}

	@Override
	public List<ASTNode> getChildren() {
		return childrenOf(getGenericParams(), getTrailingWhereClause(), members);
	}
}
