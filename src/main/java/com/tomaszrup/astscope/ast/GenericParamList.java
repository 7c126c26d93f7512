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
 * {@code <T, U: Equatable>}
 */
public class GenericParamList extends ASTNode {
	private final List<GenericTypeParamDecl> params;

	public GenericParamList(SourceLoc lAngleLoc, List<GenericTypeParamDecl> params, SourceLoc rAngleLoc) {
		super(lAngleLoc, rAngleLoc);
		this.params = new ArrayList<>(params);
	}

	public List<GenericTypeParamDecl> getParams() {
		return Collections.unmodifiableList(params);
	}

	public int size() {
		return params.size();
	}

	@Override
	public List<ASTNode> getChildren() {
		return childrenOf(params);
	}

	@Override
	protected boolean walkToPre(ASTWalker walker) {
		return true;
	}
}
