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

/**
 * {@code subscript(index: Int) -> Element { get { ... } set { ... } }}
 */
public class SubscriptDecl extends GenericContextDecl {
	private final ParameterList indices;
	private final List<AccessorDecl> accessors;

	public SubscriptDecl(SourceLoc subscriptLoc, ParameterList indices, List<AccessorDecl> accessors,
			SourceLoc endLoc) {
		super(subscriptLoc, endLoc);
		this.indices = indices;
		this.accessors = accessors != null ? new ArrayList<>(accessors) : new ArrayList<>();
	}

	public ParameterList getIndices() {
		return indices;
	}

	public List<AccessorDecl> getAccessors() {
		return Collections.unmodifiableList(accessors);
	}

	@Override
	public List<ASTNode> getChildren() {
		return childrenOf(getGenericParams(), indices, getTrailingWhereClause(), accessors);
	}
}
