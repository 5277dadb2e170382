// Copyright 2026 The LWG Project Developers
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
package lwg.lang;

/**
 * The root of a LOOP, WHILE or GOTO abstract syntax tree.
 *
 * Programs are immutable once built, so a program may be evaluated or
 * translated any number of times, from any number of threads.
 */
public interface Program {

	Language getLanguage();
}
