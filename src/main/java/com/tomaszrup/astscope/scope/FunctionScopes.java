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

import com.tomaszrup.astscope.ast.AbstractFunctionDecl;
import com.tomaszrup.astscope.ast.AccessorDecl;
import com.tomaszrup.astscope.ast.ConstructorDecl;
import com.tomaszrup.astscope.ast.Decl;
import com.tomaszrup.astscope.ast.DestructorDecl;
import com.tomaszrup.astscope.ast.FuncDecl;
import com.tomaszrup.astscope.ast.SubscriptDecl;

final class FunctionScopes {
	private FunctionScopes() {
	}

	static String describe(Decl decl) {
		if (decl instanceof FuncDecl) {
			return "'" + ((FuncDecl) decl).getName() + "'";
		}
		if (decl instanceof AccessorDecl) {
			return "'" + ((AccessorDecl) decl).getAccessorKind().name().toLowerCase() + "'";
		}
		if (decl instanceof ConstructorDecl) {
			return "'init'";
		}
		if (decl instanceof DestructorDecl) {
			return "'deinit'";
		}
		if (decl instanceof SubscriptDecl) {
			return "'subscript'";
		}
		return decl instanceof AbstractFunctionDecl ? "'function'" : "";
	}
}
