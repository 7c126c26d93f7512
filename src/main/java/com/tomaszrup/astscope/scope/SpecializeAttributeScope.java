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
package com.tomaszrup.astscope.scope;

import com.tomaszrup.astscope.ast.Decl;
import com.tomaszrup.astscope.ast.SpecializeAttr;
import com.tomaszrup.astscope.source.SourceRange;

/**
 * The where clause of a {@code @_specialize} attribute, which sees the
 * generic parameters of the declaration it decorates.
 */
public class SpecializeAttributeScope extends ASTScopeImpl {
	private final SpecializeAttr specializeAttr;
	private final Decl whatWasSpecialized;

	public SpecializeAttributeScope(SpecializeAttr specializeAttr, Decl whatWasSpecialized) {
		this.specializeAttr = specializeAttr;
		this.whatWasSpecialized = whatWasSpecialized;
	}

	public SpecializeAttr getSpecializeAttr() {
		return specializeAttr;
	}

	public Decl getWhatWasSpecialized() {
		return whatWasSpecialized;
	}

	@Override
	public SourceRange getChildlessSourceRange() {
		return specializeAttr.getRange();
	}
}
