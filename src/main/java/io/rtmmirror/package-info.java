/**
 * rtm-mirror source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.rtmmirror.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.rtmmirror.cli.RtmMirrorCommand} maps commands to the sync engine and store.</li>
 *   <li>{@code io.rtmmirror.sync.SyncEngine} runs pulls and pushes against the remote service.</li>
 *   <li>{@code io.rtmmirror.storage.RecordStore} is the authoritative local mirror.</li>
 * </ul>
 */
package io.rtmmirror;
