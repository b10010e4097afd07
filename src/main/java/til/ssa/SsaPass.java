package til.ssa;

import til.cfg.CfgArena;
import til.cfg.Scfg;

/**
 * Consumer of normalized CFGs that brings them into SSA form. It may rely on dense topological
 * block IDs, sequential instruction IDs and populated (post-)dominator trees.
 */
public interface SsaPass {

  /**
   * @param arena the arena that owns all blocks of {@code cfg}; new blocks have to be allocated
   *     from it, too
   * @return the SSA-form CFG, possibly {@code cfg} itself
   */
  Scfg transform(Scfg cfg, CfgArena arena);
}
