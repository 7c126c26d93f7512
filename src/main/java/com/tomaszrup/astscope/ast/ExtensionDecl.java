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
 * {@code extension Type where ... { members }}. The generic parameters of an
 * extension are those of the extended type and carry no location of their
 * own.
 */
public class ExtensionDecl extends GenericContextDecl {
	private final String extendedTypeName;
	private final SourceRange braces;
	private final List<Decl> members;

	public ExtensionDecl(String extendedTypeName, SourceLoc extensionLoc, SourceRange braces, List<Decl> members) {
		super(extensionLoc, braces.getEnd());
		this.extendedTypeName = extendedTypeName;
		this.braces = braces;
		this.members = members != null ? new ArrayList<>(members) : new ArrayList<>();
	}

	public String getExtendedTypeName() {
		return extendedTypeName;
	}

	public SourceRange getBraces() {
		return braces;
	}

	public List<Decl> getMembers() {
		return Collections.unmodifiableList(members);
	}

	@Override
	public List<ASTNode> getChildren() {
		return childrenOf(getTrailingWhereClause(), members);
	}
}
