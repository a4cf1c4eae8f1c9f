/*
 * Copyright 2026 The identitygate Authors. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package io.identitygate.auth.user;

/**
 * How an {@link Identity} was last authenticated.
 */
public enum AuthKind {
  /** Token signed with the locally held shared secret. */
  LOCAL,

  /** Token issued by the remote identity provider to a person. */
  REMOTE_USER,

  /** Application-only token issued by the remote identity provider. */
  REMOTE_SERVICE
}
