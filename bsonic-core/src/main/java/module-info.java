/**
 * The BSON wire format, with no mapping to Java objects.
 * <p>
 * The major packages are:
 *
 * <ul>
 *     <li>
 *         {@link works.bsonic.raw},
 *         zero-copy views over encoded bytes and the builders that produce them;
 *     </li>
 *     <li>
 *         {@link works.bsonic.types},
 *         the owned, typed value model rooted at {@link works.bsonic.types.Bson}; and
 *     </li>
 *     <li>
 *         {@link works.bsonic.exceptions},
 *         the unchecked exceptions thrown by every bsonic module.
 *     </li>
 * </ul>
 */
module works.bsonic.core {
	requires org.slf4j;

	exports works.bsonic.exceptions;
	exports works.bsonic.raw;
	exports works.bsonic.spec;
	exports works.bsonic.types;
}
